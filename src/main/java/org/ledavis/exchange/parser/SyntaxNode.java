package org.ledavis.exchange.parser;

import org.ledavis.exchange.model.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * 原始语法树的内部节点。子元素保留全部 token（包括标点），用于计算行号区间。
 */
public record SyntaxNode(Rule rule, List<SyntaxElement> children) implements SyntaxElement {

    public SyntaxNode {
        children = List.copyOf(children);
        if (children.isEmpty()) {
            throw new IllegalArgumentException("语法节点不能为空：" + rule);
        }
    }

    @Override
    public int firstLine() {
        int min = Integer.MAX_VALUE;
        for (SyntaxElement child : children) {
            min = Math.min(min, child.firstLine());
        }
        return min;
    }

    @Override
    public int lastLine() {
        int max = Integer.MIN_VALUE;
        for (SyntaxElement child : children) {
            max = Math.max(max, child.lastLine());
        }
        return max;
    }

    public SourceSpan span() {
        return new SourceSpan(firstLine(), lastLine());
    }

    /**
     * 直接子节点中属于指定规则的节点（按顺序）。
     */
    public List<SyntaxNode> nodes(Rule childRule) {
        List<SyntaxNode> out = new ArrayList<>();
        for (SyntaxElement child : children) {
            if (child instanceof SyntaxNode node && node.rule() == childRule) {
                out.add(node);
            }
        }
        return out;
    }

    /**
     * 第一个指定种类的直接子 token；不存在时返回 null。
     */
    public Token token(TokenType type) {
        for (SyntaxElement child : children) {
            if (child instanceof Token token && token.type() == type) {
                return token;
            }
        }
        return null;
    }
}
