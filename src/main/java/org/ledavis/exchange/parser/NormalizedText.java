package org.ledavis.exchange.parser;

/**
 * 预处理后的文本，以及“规范化位置 -> 原始位置”的偏移映射。
 *
 * @param text          去注释、去空白后的文本（换行保留）
 * @param sourceOffsets {@code sourceOffsets[i]} 为 {@code text.charAt(i)} 在原文中的偏移；
 *                      额外多一个元素 {@code sourceOffsets[text.length()]}，指向原文末尾
 */
public record NormalizedText(String text, int[] sourceOffsets) {

    public int sourceOffset(int normalizedOffset) {
        if (normalizedOffset < 0) {
            return 0;
        }
        if (normalizedOffset >= sourceOffsets.length) {
            return sourceOffsets[sourceOffsets.length - 1];
        }
        return sourceOffsets[normalizedOffset];
    }
}
