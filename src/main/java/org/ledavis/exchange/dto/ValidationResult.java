package org.ledavis.exchange.dto;

import org.ledavis.exchange.diagnostics.Diagnostic;

import java.util.List;

/**
 * {@code p21_validate} 的返回结果。
 *
 * @param rootId        根目录标识
 * @param path          统一后的路径（使用 '/' 分隔）
 * @param decodedWith   解码字符集
 * @param valid         是否通过语法与重名校验
 * @param headerRecords valid=true 时的 HEADER 记录数
 * @param entityCount   valid=true 时的实例数
 * @param diagnostic    valid=false 时的结构化诊断（含格式化文本）
 * @param warnings      非致命告警
 */
public record ValidationResult(
        String rootId,
        String path,
        String decodedWith,
        boolean valid,
        Integer headerRecords,
        Integer entityCount,
        Diagnostic diagnostic,
        List<String> warnings
) {
}
