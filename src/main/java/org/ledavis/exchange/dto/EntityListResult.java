package org.ledavis.exchange.dto;

import java.util.List;

/**
 * {@code p21_list_entities} 的返回结果（DATA 段实体分页列表）。
 *
 * @param rootId        根目录标识
 * @param path          统一后的路径（使用 '/' 分隔）
 * @param decodedWith   对文件字节流使用的解码字符集
 * @param totalEntities 模型中的实例总数
 * @param matched       满足过滤条件的实例数
 * @param offset        匹配偏移（0-based）
 * @param limit         返回上限
 * @param hasMore       是否还有更多匹配项
 * @param nextOffset    hasMore=true 时建议下一次请求的 offset
 * @param entities      实体列表
 * @param warnings      非致命告警
 */
public record EntityListResult(
        String rootId,
        String path,
        String decodedWith,
        int totalEntities,
        int matched,
        int offset,
        int limit,
        boolean hasMore,
        Integer nextOffset,
        List<EntitySnippet> entities,
        List<String> warnings
) {
}
