package org.ledavis.exchange.dto;

/**
 * 图节点的传输形式。
 *
 * @param id    实例 id
 * @param label 显示名（{@code #id}）
 * @param title 标题（多行用 {@code <br>} 分隔；行内 {@code &}、{@code <} 转义为 {@code &amp;}、{@code &lt;}）
 * @param color 语义颜色标签（entry/failure/point/...），未设置时为 null
 */
public record GraphNodeItem(long id, String label, String title, String color) {
}
