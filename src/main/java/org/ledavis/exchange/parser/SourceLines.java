package org.ledavis.exchange.parser;

import java.util.Arrays;

/**
 * 原始文件文本的行索引：把字符偏移换算成 1-based 行号/列号，并按行号取回原文行。
 * <p>
 * 诊断信息中展示的行文本永远取自原始文件（而不是去注释/去空白后的文本）。
 */
public final class SourceLines {

    private final String text;
    private final int[] lineStarts;

    public SourceLines(String text) {
        this.text = (text == null) ? "" : text;
        int[] starts = new int[16];
        int count = 0;
        starts[count++] = 0;
        for (int i = 0; i < this.text.length(); i++) {
            if (this.text.charAt(i) == '\n') {
                if (count == starts.length) {
                    starts = Arrays.copyOf(starts, count * 2);
                }
                starts[count++] = i + 1;
            }
        }
        this.lineStarts = Arrays.copyOf(starts, count);
    }

    public String text() {
        return text;
    }

    public int lineCount() {
        return lineStarts.length;
    }

    /**
     * 偏移所在行（1-based）。偏移允许等于文本长度（文件末尾）。
     */
    public int lineOf(int offset) {
        int index = Arrays.binarySearch(lineStarts, Math.max(0, Math.min(offset, text.length())));
        if (index >= 0) {
            return index + 1;
        }
        return -index - 1;
    }

    /**
     * 偏移所在列（1-based，按字符计）。
     */
    public int columnOf(int offset) {
        int clamped = Math.max(0, Math.min(offset, text.length()));
        return clamped - lineStarts[lineOf(clamped) - 1] + 1;
    }

    /**
     * 取回第 {@code line} 行的原文（不含换行符，行尾的 '\r' 也会去掉）；越界时返回空字符串。
     */
    public String line(int line) {
        if (line < 1 || line > lineStarts.length) {
            return "";
        }
        int start = lineStarts[line - 1];
        int end = (line < lineStarts.length) ? lineStarts[line] - 1 : text.length();
        if (end > start && text.charAt(end - 1) == '\r') {
            end--;
        }
        return text.substring(start, end);
    }
}
