package org.ledavis.exchange.index;

import org.ledavis.exchange.model.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * 从规范化的值中收集全部 {@code #id} 引用（深度优先、按出现顺序，允许重复）。
 * <p>
 * 不区分引用出现的语法位置：类型参数内部、列表元素、复杂实例成员中的引用都算图的边，
 * 图对引用是“完备”的，而不是按 EXPRESS schema 感知的。
 */
public final class ReferenceCollector {

    private ReferenceCollector() {
    }

    public static List<Long> collect(Value value) {
        List<Long> refs = new ArrayList<>();
        collect(value, refs);
        return refs;
    }

    private static void collect(Value value, List<Long> refs) {
        if (value instanceof Value.Ref ref) {
            refs.add(ref.id());
        } else if (value instanceof Value.Aggregate aggregate) {
            for (Value item : aggregate.items()) {
                collect(item, refs);
            }
        } else if (value instanceof Value.Typed typed) {
            collect(typed.inner(), refs);
        } else if (value instanceof Value.SimpleRecord record) {
            for (Value parameter : record.parameters()) {
                collect(parameter, refs);
            }
        } else if (value instanceof Value.ComplexRecord complex) {
            for (Value.SimpleRecord record : complex.records()) {
                collect(record, refs);
            }
        } else if (!(value instanceof Value.Str || value instanceof Value.Int || value instanceof Value.Real
                || value instanceof Value.None || value instanceof Value.Omitted
                || value instanceof Value.Enumeration || value instanceof Value.Binary)) {
            throw new IllegalStateException("未知的值类型：" + value);
        }
    }
}
