package org.ledavis.exchange.diagnostics;

import java.util.List;

/**
 * 语法/词法错误：在第一个无法继续任何产生式的 token（或无法识别的字符）处立即抛出，不做恢复。
 */
public class Part21SyntaxException extends ValidationException {

    public enum Kind {
        UNEXPECTED_TOKEN("unexpected_token"),
        UNEXPECTED_CHARACTER("unexpected_character");

        private final String code;

        Kind(String code) {
            this.code = code;
        }

        public String code() {
            return code;
        }
    }

    private final Kind kind;
    private final int line;
    private final int column;
    private final String foundType;
    private final String foundValue;
    private final List<String> expected;
    private final String lineText;

    /**
     * @param expected    期望的终结符名称（已排序、已去除内部终结符）
     * @param expectation 非空时替代 “Expecting ...” 中由期望集合生成的描述（用于数值越界这类非语法性原因）
     */
    public Part21SyntaxException(Kind kind, int line, int column, String foundType, String foundValue,
                                 List<String> expected, String lineText, String expectation) {
        super(DiagnosticFormatter.formatSyntax(kind, line, column, foundType, foundValue, expected, lineText, expectation));
        this.kind = kind;
        this.line = line;
        this.column = column;
        this.foundType = foundType;
        this.foundValue = foundValue;
        this.expected = List.copyOf(expected);
        this.lineText = lineText;
    }

    public Kind kind() {
        return kind;
    }

    @Override
    public int lineNumber() {
        return line;
    }

    public int column() {
        return column;
    }

    public String foundType() {
        return foundType;
    }

    public String foundValue() {
        return foundValue;
    }

    public List<String> expected() {
        return expected;
    }

    public String lineText() {
        return lineText;
    }

    @Override
    public Diagnostic toDiagnostic(boolean withMessage) {
        return new Diagnostic(
                kind.code(),
                null,
                line,
                column,
                foundType,
                foundValue,
                expected,
                lineText,
                withMessage ? getMessage() : null
        );
    }
}
