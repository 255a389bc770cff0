package org.ledavis.exchange.graph;

/**
 * 有向边：{@code from} 实例引用了 {@code to}。
 */
public record GraphEdge(long from, long to) {
}
