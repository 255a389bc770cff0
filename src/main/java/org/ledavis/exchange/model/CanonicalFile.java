package org.ledavis.exchange.model;

import java.util.List;

/**
 * 规范化器的输出：HEADER 记录 + 按文件顺序排列的 DATA 实体。
 */
public record CanonicalFile(List<HeaderEntity> header, List<CanonicalEntity> entities) {

    public CanonicalFile {
        header = List.copyOf(header);
        entities = List.copyOf(entities);
    }
}
