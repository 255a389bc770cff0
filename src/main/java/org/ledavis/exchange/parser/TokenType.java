package org.ledavis.exchange.parser;

/**
 * 终结符（token）种类。
 * <p>
 * {@link #terminalName()} 用于语法错误中的“期望集合”；{@link #reported()} 为 false 的内部终结符
 * 不会出现在期望集合中。
 */
public enum TokenType {
    ISO("ISO"),
    END("END"),
    HEADER("HEADER"),
    DATA("DATA"),
    ENDSEC("ENDSEC"),
    KEYWORD("KEYWORD"),
    ID("ID"),
    INT("INT"),
    REAL("REAL"),
    STRING("STRING"),
    ENUMERATION("ENUMERATION"),
    BINARY("BINARY"),
    SEMICOLON("SEMICOLON"),
    LPAR("LPAR"),
    RPAR("RPAR"),
    COMMA("COMMA"),
    EQUAL("EQUAL"),
    DOLLAR("DOLLAR"),
    STAR("STAR"),
    EOF("$END"),
    /**
     * 无法识别的字符；只作为“错误 token”交给语法分析器报告，永远不会被期望。
     */
    ERROR("__ERROR", false);

    private final String terminalName;
    private final boolean reported;

    TokenType(String terminalName) {
        this(terminalName, true);
    }

    TokenType(String terminalName, boolean reported) {
        this.terminalName = terminalName;
        this.reported = reported;
    }

    public String terminalName() {
        return terminalName;
    }

    public boolean reported() {
        return reported;
    }
}
