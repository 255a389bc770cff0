package org.ledavis.exchange.dto;

/**
 * 实体类型计数项。
 *
 * @param type  实体关键字（如 CARTESIAN_POINT）
 * @param count 出现次数；复合实例按每个成员关键字各计一次
 */
public record EntityTypeCount(String type, int count) {
}
