package org.ledavis.exchange.model;

import java.util.List;
import java.util.Objects;

/**
 * DATA 段中的一条实体实例（{@code #id=...;}）。
 *
 * @param id   实例 id（'#' 后面的数字）
 * @param body 实例本体：{@link Value.SimpleRecord} 或 {@link Value.ComplexRecord}
 * @param refs body 中按出现顺序收集到的全部引用 id（允许重复）
 * @param span 该实例在源文件中的行号区间
 */
public record EntityInstance(long id, Value body, List<Long> refs, SourceSpan span) {

    public EntityInstance {
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(span, "span");
        if (!(body instanceof Value.SimpleRecord) && !(body instanceof Value.ComplexRecord)) {
            throw new IllegalArgumentException("实体本体必须是记录：" + body);
        }
        refs = List.copyOf(refs);
    }

    /**
     * 组成该实例的简单记录（简单实例只有一条）。
     */
    public List<Value.SimpleRecord> records() {
        if (body instanceof Value.SimpleRecord simple) {
            return List.of(simple);
        }
        return ((Value.ComplexRecord) body).records();
    }

    public String name() {
        return "#" + id;
    }
}
