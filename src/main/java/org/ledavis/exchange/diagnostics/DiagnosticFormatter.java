package org.ledavis.exchange.diagnostics;

import java.util.List;
import java.util.Locale;

/**
 * 报错文本格式化。
 * <p>
 * 格式：一行位置说明 + 原因 + 带 5 位行号前缀的原文行 + 插入符标记。
 * <pre>
 * On line 3 column 14:
 * Unexpected semicolon (';')
 * Expecting one of BINARY DOLLAR ...
 * 00003 | #1=FOO(;
 *                ^
 * </pre>
 * 重名错误用一串 {@code ^} 标出整行。
 */
final class DiagnosticFormatter {

    // "00003 | " 的宽度，插入符从这里开始对齐
    private static final String GUTTER = " ".repeat(8);

    private DiagnosticFormatter() {
    }

    static String formatSyntax(Part21SyntaxException.Kind kind, int line, int column, String foundType,
                               String foundValue, List<String> expected, String lineText, String expectation) {
        String found = (kind == Part21SyntaxException.Kind.UNEXPECTED_CHARACTER)
                ? "character"
                : foundType;
        StringBuilder out = new StringBuilder();
        out.append("On line ").append(line).append(" column ").append(column).append(":\n");
        out.append("Unexpected ").append(found).append(" ('").append(foundValue).append("')\n");
        out.append("Expecting ").append(expectation != null ? expectation : describe(expected)).append('\n');
        out.append(gutter(line)).append(lineText).append('\n');
        out.append(GUTTER).append(" ".repeat(Math.max(0, column - 1))).append('^');
        return out.toString();
    }

    static String formatDuplicate(String name, int line, String lineText) {
        return "On line " + line + ":\n"
                + "Duplicate instance name " + name + "\n"
                + gutter(line) + lineText + "\n"
                + GUTTER + "^".repeat(lineText.stripTrailing().length());
    }

    private static String describe(List<String> expected) {
        if (expected.size() == 1) {
            return expected.get(0);
        }
        return "one of " + String.join(" ", expected);
    }

    private static String gutter(int line) {
        return String.format(Locale.ROOT, "%05d | ", line);
    }
}
