package org.ledavis.exchange.index;

import org.ledavis.exchange.diagnostics.DuplicateNameException;
import org.ledavis.exchange.model.CanonicalEntity;
import org.ledavis.exchange.model.EntityInstance;
import org.ledavis.exchange.parser.SourceLines;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 遍历规范化后的 DATA 段，按文件顺序建立 {@code id -> 实体实例} 索引。
 * <p>
 * 每个实例的 refs 由 {@link ReferenceCollector} 从 body 推导，不会单独解析或手工修改。
 * 同一 id 第二次出现时立即抛出 {@link DuplicateNameException}（行号取第二次出现的位置），
 * 索引随即终止；即使两次出现的内容完全相同也视为错误。
 */
public final class EntityIndexer {

    private EntityIndexer() {
    }

    public static Map<Long, EntityInstance> index(List<CanonicalEntity> entities, SourceLines lines) {
        Map<Long, EntityInstance> index = new LinkedHashMap<>(Math.max(16, entities.size() * 4 / 3 + 1));
        for (CanonicalEntity entity : entities) {
            if (index.containsKey(entity.id())) {
                throw new DuplicateNameException(
                        "#" + entity.id(),
                        entity.span(),
                        lines.line(entity.span().firstLine())
                );
            }
            List<Long> refs = ReferenceCollector.collect(entity.body());
            index.put(entity.id(), new EntityInstance(entity.id(), entity.body(), refs, entity.span()));
        }
        return index;
    }
}
