package org.ledavis.exchange.parser;

/**
 * 词法分析器：把预处理后的文本切成终结符。
 * <p>
 * 按需产出 token（由语法分析器逐个拉取）。遇到无法识别的字符时不抛异常，而是返回一个
 * {@link TokenType#ERROR} token，由语法分析器结合当前的期望集合报告 {@code unexpected_character}。
 * <p>
 * 终结符形式：
 * <ul>
 *   <li>关键字：{@code [A-Z][0-9A-Z_]*}；{@code HEADER}/{@code DATA}/{@code ENDSEC} 为保留字</li>
 *   <li>文件标记：{@code ISO-xxx-yyy}、{@code END-}</li>
 *   <li>实例 id：{@code #[0-9]+}</li>
 *   <li>整数：可带符号的数字串；实数：必须带小数点，可带 {@code E} 指数</li>
 *   <li>字符串：{@code '...'}，{@code ''} 表示单引号，支持 {@code \S\ \P?\ \X\ \X2\ \X4\} 控制指令</li>
 *   <li>枚举：{@code .NAME.}；位串：{@code "} 0-3 十六进制* {@code "}</li>
 * </ul>
 */
public final class Lexer {

    private final NormalizedText normalized;
    private final SourceLines lines;
    private final String text;
    private int pos;

    public Lexer(NormalizedText normalized, SourceLines lines) {
        this.normalized = normalized;
        this.lines = lines;
        this.text = normalized.text();
    }

    public Token next() {
        int len = text.length();
        while (pos < len && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
        if (pos >= len) {
            return token(TokenType.EOF, len, len);
        }

        int start = pos;
        char c = text.charAt(pos);
        Token token = switch (c) {
            case ';' -> single(TokenType.SEMICOLON, start);
            case '(' -> single(TokenType.LPAR, start);
            case ')' -> single(TokenType.RPAR, start);
            case ',' -> single(TokenType.COMMA, start);
            case '=' -> single(TokenType.EQUAL, start);
            case '$' -> single(TokenType.DOLLAR, start);
            case '*' -> single(TokenType.STAR, start);
            case '#' -> lexId(start);
            case '\'' -> lexString(start);
            case '"' -> lexBinary(start);
            case '.' -> lexEnumeration(start);
            default -> null;
        };
        if (token != null) {
            return token;
        }
        if (isDigit(c) || ((c == '+' || c == '-') && pos + 1 < len && isDigit(text.charAt(pos + 1)))) {
            return lexNumber(start);
        }
        if (isUpper(c)) {
            return lexWord(start);
        }
        return error(start);
    }

    private Token single(TokenType type, int start) {
        pos = start + 1;
        return token(type, start, pos);
    }

    private Token lexId(int start) {
        int i = start + 1;
        while (i < text.length() && isDigit(text.charAt(i))) {
            i++;
        }
        if (i == start + 1) {
            return error(start);
        }
        pos = i;
        return token(TokenType.ID, start, i);
    }

    private Token lexString(int start) {
        int len = text.length();
        int i = start + 1;
        while (true) {
            if (i >= len) {
                // 未闭合的字符串：报告在起始引号处
                return error(start);
            }
            char ch = text.charAt(i);
            if (ch == '\'') {
                if (i + 1 < len && text.charAt(i + 1) == '\'') {
                    i += 2;
                    continue;
                }
                i++;
                break;
            }
            if (ch == '\\') {
                int consumed = directiveLength(i);
                if (consumed < 0) {
                    return error(i);
                }
                i += consumed;
                continue;
            }
            i++;
        }
        pos = i;
        return token(TokenType.STRING, start, i);
    }

    /**
     * 返回从 {@code i}（反斜杠）开始的控制指令长度；格式损坏的 {@code \X\ \X2\ \X4\ \S\} 返回 -1。
     * 不构成任何已知指令的反斜杠按普通字符处理（长度 1）。
     */
    private int directiveLength(int i) {
        int len = text.length();
        if (text.startsWith("\\\\", i)) {
            return 2;
        }
        if (text.startsWith("\\S\\", i)) {
            return (i + 3 < len) ? 4 : -1;
        }
        if (text.startsWith("\\P", i) && i + 3 < len
                && text.charAt(i + 2) >= 'A' && text.charAt(i + 2) <= 'I' && text.charAt(i + 3) == '\\') {
            return 4;
        }
        if (text.startsWith("\\X2\\", i) || text.startsWith("\\X4\\", i)) {
            int group = (text.charAt(i + 2) == '4') ? 8 : 4;
            int j = i + 4;
            while (j < len && isHex(text.charAt(j))) {
                j++;
            }
            int digits = j - (i + 4);
            if (!text.startsWith("\\X0\\", j) || digits % group != 0) {
                return -1;
            }
            return j + 4 - i;
        }
        if (text.startsWith("\\X\\", i)) {
            return (i + 4 < len && isHex(text.charAt(i + 3)) && isHex(text.charAt(i + 4))) ? 5 : -1;
        }
        return 1;
    }

    private Token lexBinary(int start) {
        int len = text.length();
        int i = start + 1;
        if (i >= len || text.charAt(i) < '0' || text.charAt(i) > '3') {
            return error(i < len ? i : start);
        }
        i++;
        while (i < len && isHex(text.charAt(i))) {
            i++;
        }
        if (i >= len || text.charAt(i) != '"') {
            return error(i < len ? i : start);
        }
        pos = i + 1;
        return token(TokenType.BINARY, start, pos);
    }

    private Token lexEnumeration(int start) {
        int len = text.length();
        int i = start + 1;
        if (i >= len || !isUpper(text.charAt(i))) {
            return error(start);
        }
        while (i < len && isKeywordPart(text.charAt(i))) {
            i++;
        }
        if (i >= len || text.charAt(i) != '.') {
            return error(i < len ? i : start);
        }
        pos = i + 1;
        return token(TokenType.ENUMERATION, start, pos);
    }

    private Token lexNumber(int start) {
        int len = text.length();
        int i = start;
        char first = text.charAt(i);
        if (first == '+' || first == '-') {
            i++;
        }
        while (i < len && isDigit(text.charAt(i))) {
            i++;
        }
        if (i >= len || text.charAt(i) != '.') {
            pos = i;
            return token(TokenType.INT, start, i);
        }
        i++;
        while (i < len && isDigit(text.charAt(i))) {
            i++;
        }
        if (i < len && text.charAt(i) == 'E') {
            int j = i + 1;
            if (j < len && (text.charAt(j) == '+' || text.charAt(j) == '-')) {
                j++;
            }
            if (j < len && isDigit(text.charAt(j))) {
                while (j < len && isDigit(text.charAt(j))) {
                    j++;
                }
                i = j;
            }
        }
        pos = i;
        return token(TokenType.REAL, start, i);
    }

    private Token lexWord(int start) {
        int len = text.length();
        int i = start;
        while (i < len && isKeywordPart(text.charAt(i))) {
            i++;
        }
        String word = text.substring(start, i);
        boolean dash = i < len && text.charAt(i) == '-';

        if (dash && word.equals("ISO")) {
            return lexIsoMarker(start, i);
        }
        if (dash && word.equals("END")) {
            pos = i + 1;
            return token(TokenType.END, start, pos);
        }

        pos = i;
        return switch (word) {
            case "HEADER" -> token(TokenType.HEADER, start, i);
            case "DATA" -> token(TokenType.DATA, start, i);
            case "ENDSEC" -> token(TokenType.ENDSEC, start, i);
            default -> token(TokenType.KEYWORD, start, i);
        };
    }

    // ISO-<edition>-<edition>，例如 ISO-10303-21
    private Token lexIsoMarker(int start, int dash) {
        int j = dash + 1;
        int partStart = j;
        while (j < text.length() && Character.isLetterOrDigit(text.charAt(j)) && text.charAt(j) < 128) {
            j++;
        }
        if (j == partStart || j >= text.length() || text.charAt(j) != '-') {
            return error(Math.min(j, text.length() - 1));
        }
        j++;
        partStart = j;
        while (j < text.length() && Character.isLetterOrDigit(text.charAt(j)) && text.charAt(j) < 128) {
            j++;
        }
        if (j == partStart) {
            return error(Math.min(j, text.length() - 1));
        }
        pos = j;
        return token(TokenType.ISO, start, j);
    }

    private Token error(int at) {
        pos = at + 1;
        return token(TokenType.ERROR, at, at + 1);
    }

    private Token token(TokenType type, int start, int end) {
        int sourceStart = normalized.sourceOffset(start);
        int sourceLast = (end > start) ? normalized.sourceOffset(end - 1) : sourceStart;
        String value = (end > start) ? text.substring(start, Math.min(end, text.length())) : "";
        return new Token(type, value, lines.lineOf(sourceStart), lines.columnOf(sourceStart), lines.lineOf(sourceLast));
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isUpper(char c) {
        return c >= 'A' && c <= 'Z';
    }

    private static boolean isKeywordPart(char c) {
        return isUpper(c) || isDigit(c) || c == '_';
    }

    static boolean isHex(char c) {
        return isDigit(c) || (c >= 'A' && c <= 'F') || (c >= 'a' && c <= 'f');
    }
}
