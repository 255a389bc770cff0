package org.ledavis.exchange.model;

/**
 * 源文件行号区间（1-based，首尾均包含）。
 * <p>
 * 仅用于诊断信息（报错时定位原文），不参与任何语义判断。
 *
 * @param firstLine 起始行
 * @param lastLine  结束行
 */
public record SourceSpan(int firstLine, int lastLine) {

    public SourceSpan {
        if (firstLine < 1 || lastLine < firstLine) {
            throw new IllegalArgumentException("非法行号区间：" + firstLine + ".." + lastLine);
        }
    }

    public static SourceSpan ofLine(int line) {
        return new SourceSpan(line, line);
    }
}
