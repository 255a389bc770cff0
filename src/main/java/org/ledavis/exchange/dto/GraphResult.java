package org.ledavis.exchange.dto;

import java.util.List;

/**
 * {@code p21_build_graph} 的返回结果。
 *
 * @param rootId     根目录标识
 * @param path       统一后的路径（使用 '/' 分隔）
 * @param mode       {@code complete} 或 {@code rooted}
 * @param entityId   rooted 模式的起点 id
 * @param totalNodes 图中节点总数
 * @param totalEdges 图中边总数
 * @param truncated  是否因 graphMaxNodes 只返回了部分节点（边只保留两端都已返回的）
 * @param nodes      节点（按插入顺序）
 * @param edges      边（按插入顺序）
 * @param warnings   非致命告警
 */
public record GraphResult(
        String rootId,
        String path,
        String mode,
        Long entityId,
        int totalNodes,
        int totalEdges,
        boolean truncated,
        List<GraphNodeItem> nodes,
        List<GraphEdgeItem> edges,
        List<String> warnings
) {
}
