package org.ledavis.exchange.model;

import java.util.List;

/**
 * 把 {@link Value} 还原成 Part 21 风格的文本（用于节点标题、实体列表等展示场景）。
 * <p>
 * 输出与源文本“文本等价”：重新解析输出会得到相同的值（忽略空白差异）。
 * 字符串中的非 ASCII 字符保持解码后的形式，不会重新编码为 {@code \X2\...\X0\}。
 */
public final class ValueFormatter {

    private ValueFormatter() {
    }

    public static String format(Value value) {
        StringBuilder out = new StringBuilder();
        append(out, value);
        return out.toString();
    }

    /**
     * 参数列表：逗号 + 空格连接，外层加括号。
     */
    public static String formatParameters(List<Value> parameters) {
        StringBuilder out = new StringBuilder();
        appendParenthesized(out, parameters);
        return out.toString();
    }

    private static void append(StringBuilder out, Value value) {
        if (value instanceof Value.Str str) {
            appendQuoted(out, str.text());
        } else if (value instanceof Value.Int i) {
            out.append(i.value());
        } else if (value instanceof Value.Real r) {
            out.append(formatReal(r.value()));
        } else if (value instanceof Value.None) {
            out.append('$');
        } else if (value instanceof Value.Omitted) {
            out.append('*');
        } else if (value instanceof Value.Enumeration e) {
            out.append('.').append(e.name()).append('.');
        } else if (value instanceof Value.Ref ref) {
            out.append('#').append(ref.id());
        } else if (value instanceof Value.Binary b) {
            out.append('"').append(b.bitsToDiscard()).append(b.hexDigits()).append('"');
        } else if (value instanceof Value.Aggregate aggregate) {
            appendParenthesized(out, aggregate.items());
        } else if (value instanceof Value.Typed typed) {
            out.append(typed.keyword()).append('(');
            append(out, typed.inner());
            out.append(')');
        } else if (value instanceof Value.SimpleRecord record) {
            out.append(record.keyword());
            appendParenthesized(out, record.parameters());
        } else if (value instanceof Value.ComplexRecord complex) {
            out.append('(');
            for (Value.SimpleRecord record : complex.records()) {
                append(out, record);
            }
            out.append(')');
        } else {
            throw new IllegalStateException("未知的值类型：" + value);
        }
    }

    private static void appendParenthesized(StringBuilder out, List<Value> values) {
        out.append('(');
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                out.append(", ");
            }
            append(out, values.get(i));
        }
        out.append(')');
    }

    private static void appendQuoted(StringBuilder out, String text) {
        out.append('\'');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\'') {
                out.append("''");
            } else if (c == '\\') {
                out.append("\\\\");
            } else {
                out.append(c);
            }
        }
        out.append('\'');
    }

    // Double.toString 总是带小数点（例如 1.0、1.5E-5），满足 REAL 字面量的语法要求
    static String formatReal(double value) {
        return Double.toString(value);
    }
}
