package org.ledavis.exchange.graph;

/**
 * 图节点。
 *
 * @param id    实例 id
 * @param label 显示名（{@code #id}）
 * @param title 悬停标题；多行时用 {@link NodeStyler#LINE_BREAK} 分隔，行内 {@code &}、{@code <} 已转义
 * @param color 颜色标签；null 表示使用渲染器默认色
 */
public record GraphNode(long id, String label, String title, NodeColor color) {
}
