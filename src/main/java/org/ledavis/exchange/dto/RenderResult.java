package org.ledavis.exchange.dto;

import java.util.List;

/**
 * {@code p21_render_graph} 的返回结果。
 *
 * @param rootId     根目录标识
 * @param path       输入文件路径
 * @param outputPath 写出的产物路径
 * @param mode       {@code complete} 或 {@code rooted}
 * @param nodes      节点数
 * @param edges      边数
 * @param bytes      产物大小（字节）
 * @param warnings   非致命告警
 */
public record RenderResult(
        String rootId,
        String path,
        String outputPath,
        String mode,
        int nodes,
        int edges,
        long bytes,
        List<String> warnings
) {
}
