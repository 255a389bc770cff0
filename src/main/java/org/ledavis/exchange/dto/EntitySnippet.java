package org.ledavis.exchange.dto;

import java.util.List;

/**
 * 实体列表中的一项。
 *
 * @param id        实例 id
 * @param keywords  成员记录关键字（简单实例只有一个）
 * @param firstLine 起始行号（1-based）
 * @param lastLine  结束行号
 * @param refs      按出现顺序的引用 id
 * @param text      实例本体的 Part 21 文本（未换行；复合实例形如 {@code (A(...)B(...))}）
 */
public record EntitySnippet(
        long id,
        List<String> keywords,
        int firstLine,
        int lastLine,
        List<Long> refs,
        String text
) {
}
