package org.ledavis.exchange.dto;

/**
 * 有向边 {@code from -> to}。
 */
public record GraphEdgeItem(long from, long to) {
}
