package org.ledavis.exchange.model;

import java.util.List;
import java.util.Objects;

/**
 * 规范化后的参数值模型（ISO-10303-21 DATA/HEADER 段中出现的一切参数）。
 * <p>
 * 这是一个封闭的代数类型：所有遍历代码（引用收集、标题渲染）都必须覆盖全部分支，
 * 新增分支时编译器会通过 {@code permits} 列表提示需要同步修改的位置。
 * <ul>
 *   <li>{@link Str}：已解码转义/控制指令的字符串</li>
 *   <li>{@link Int}/{@link Real}：整数与实数（实数字面量必须带小数点）</li>
 *   <li>{@link None}：{@code $}，显式“未设置”</li>
 *   <li>{@link Omitted}：{@code *}，“未提供/派生属性”，与 {@code $} 语义不同</li>
 *   <li>{@link Enumeration}：{@code .NAME.}</li>
 *   <li>{@link Ref}：{@code #123}，指向另一个实体实例</li>
 *   <li>{@link Binary}：{@code "0FF"} 形式的位串</li>
 *   <li>{@link Aggregate}：括号列表</li>
 *   <li>{@link Typed}：{@code KEYWORD(value)} 形式的显式类型参数</li>
 *   <li>{@link SimpleRecord}/{@link ComplexRecord}：实体实例本体</li>
 * </ul>
 */
public sealed interface Value permits Value.Str, Value.Int, Value.Real, Value.None, Value.Omitted,
        Value.Enumeration, Value.Ref, Value.Binary, Value.Aggregate, Value.Typed,
        Value.SimpleRecord, Value.ComplexRecord {

    None NONE = new None();
    Omitted OMITTED = new Omitted();

    record Str(String text) implements Value {
        public Str {
            Objects.requireNonNull(text, "text");
        }
    }

    record Int(long value) implements Value {
    }

    record Real(double value) implements Value {
    }

    record None() implements Value {
    }

    record Omitted() implements Value {
    }

    record Enumeration(String name) implements Value {
        public Enumeration {
            Objects.requireNonNull(name, "name");
        }
    }

    record Ref(long id) implements Value {
    }

    /**
     * @param bitsToDiscard 首位数字（0-3）：最高位十六进制数中无效的位数
     * @param hexDigits     其余十六进制数字（大写，可为空）
     */
    record Binary(int bitsToDiscard, String hexDigits) implements Value {
        public Binary {
            if (bitsToDiscard < 0 || bitsToDiscard > 3) {
                throw new IllegalArgumentException("bitsToDiscard 只能为 0-3：" + bitsToDiscard);
            }
            Objects.requireNonNull(hexDigits, "hexDigits");
        }
    }

    /**
     * 聚合（列表）。Part 21 中 LIST/SET/BAG/ARRAY 在语法层面不可区分，统一为有序列表。
     */
    record Aggregate(List<Value> items) implements Value {
        public Aggregate {
            items = List.copyOf(items);
        }
    }

    record Typed(String keyword, Value inner) implements Value {
        public Typed {
            Objects.requireNonNull(keyword, "keyword");
            Objects.requireNonNull(inner, "inner");
        }
    }

    record SimpleRecord(String keyword, List<Value> parameters) implements Value {
        public SimpleRecord {
            Objects.requireNonNull(keyword, "keyword");
            parameters = List.copyOf(parameters);
        }
    }

    /**
     * 复杂实体实例：多个超类型记录共同组成一个实例（多继承实例化）。
     */
    record ComplexRecord(List<SimpleRecord> records) implements Value {
        public ComplexRecord {
            records = List.copyOf(records);
        }
    }
}
