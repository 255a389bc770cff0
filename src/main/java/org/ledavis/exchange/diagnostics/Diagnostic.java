package org.ledavis.exchange.diagnostics;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * 结构化诊断记录（CLI {@code --json} 输出 / MCP 工具返回）。
 * <p>
 * 语法错误：{@code type/lineno/column/found_type/found_value/expected/line/message}；
 * 重名错误：{@code type/name/lineno/line/message}。不适用的字段为 null，序列化时省略。
 *
 * @param type       {@code unexpected_token} / {@code unexpected_character} / {@code duplicate_name}
 * @param name       重名的实例名（例如 {@code #1}）
 * @param lineno     行号（1-based）
 * @param column     列号（1-based，仅语法错误）
 * @param foundType  实际遇到的终结符种类（小写）
 * @param foundValue 实际遇到的文本
 * @param expected   期望的终结符集合（已排序）
 * @param line       出错行的原文
 * @param message    格式化后的多行报错文本
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"type", "name", "lineno", "column", "found_type", "found_value", "expected", "line", "message"})
public record Diagnostic(
        String type,
        String name,
        Integer lineno,
        Integer column,
        @JsonProperty("found_type") String foundType,
        @JsonProperty("found_value") String foundValue,
        List<String> expected,
        String line,
        String message
) {
}
