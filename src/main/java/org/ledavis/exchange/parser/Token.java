package org.ledavis.exchange.parser;

/**
 * 词法单元。
 *
 * @param type      种类
 * @param text      原样文本（字符串/位串含引号，未解码）
 * @param line      起始行（1-based，原文）
 * @param column    起始列（1-based，原文）
 * @param endLine   结束行（跨行字符串时大于 line）
 */
public record Token(TokenType type, String text, int line, int column, int endLine) implements SyntaxElement {

    @Override
    public int firstLine() {
        return line;
    }

    @Override
    public int lastLine() {
        return endLine;
    }
}
