package org.ledavis.exchange.model;

/**
 * 规范化之后、建索引之前的 DATA 段实体（尚未计算 refs，也未做重名检查）。
 */
public record CanonicalEntity(long id, Value body, SourceSpan span) {
}
