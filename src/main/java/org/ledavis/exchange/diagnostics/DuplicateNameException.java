package org.ledavis.exchange.diagnostics;

import org.ledavis.exchange.model.SourceSpan;

/**
 * 实例重名：同一个 {@code #id} 在 DATA 段中第二次出现时立即抛出。
 * <p>
 * 行号取第二次出现的实例的起始行。即使两次出现的内容完全相同也视为错误。
 */
public class DuplicateNameException extends ValidationException {

    private final String name;
    private final SourceSpan span;
    private final String lineText;

    public DuplicateNameException(String name, SourceSpan span, String lineText) {
        super(DiagnosticFormatter.formatDuplicate(name, span.firstLine(), lineText));
        this.name = name;
        this.span = span;
        this.lineText = lineText;
    }

    public String name() {
        return name;
    }

    public SourceSpan span() {
        return span;
    }

    @Override
    public int lineNumber() {
        return span.firstLine();
    }

    public String lineText() {
        return lineText;
    }

    @Override
    public Diagnostic toDiagnostic(boolean withMessage) {
        return new Diagnostic(
                "duplicate_name",
                name,
                span.firstLine(),
                null,
                null,
                null,
                null,
                lineText,
                withMessage ? getMessage() : null
        );
    }
}
