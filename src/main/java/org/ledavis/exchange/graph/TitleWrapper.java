package org.ledavis.exchange.graph;

import java.util.ArrayList;
import java.util.List;

/**
 * 按固定宽度对标题做软换行：在空格处断行，超过宽度的单词被硬切分（先填满当前行的剩余空间）。
 * 行首/行尾的空格被丢弃。
 */
final class TitleWrapper {

    private TitleWrapper() {
    }

    static List<String> wrap(String text, int width) {
        if (width < 1) {
            throw new IllegalArgumentException("换行宽度必须大于 0：" + width);
        }
        List<String> lines = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String chunk : text.split(" ")) {
            String word = chunk;
            if (word.isEmpty()) {
                continue;
            }
            while (word.length() > width) {
                int room = current.length() == 0 ? width : width - current.length() - 1;
                if (room <= 0) {
                    lines.add(current.toString());
                    current.setLength(0);
                    continue;
                }
                if (current.length() > 0) {
                    current.append(' ');
                }
                current.append(word, 0, room);
                lines.add(current.toString());
                current.setLength(0);
                word = word.substring(room);
            }
            if (word.isEmpty()) {
                continue;
            }
            if (current.length() == 0) {
                current.append(word);
            } else if (current.length() + 1 + word.length() <= width) {
                current.append(' ').append(word);
            } else {
                lines.add(current.toString());
                current.setLength(0);
                current.append(word);
            }
        }
        if (current.length() > 0) {
            lines.add(current.toString());
        }
        return lines;
    }
}
