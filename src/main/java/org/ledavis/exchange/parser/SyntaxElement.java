package org.ledavis.exchange.parser;

/**
 * 原始语法树的元素：内部节点 {@link SyntaxNode} 或叶子 {@link Token}。
 */
public sealed interface SyntaxElement permits SyntaxNode, Token {

    int firstLine();

    int lastLine();
}
