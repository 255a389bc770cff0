package org.ledavis.exchange.parser;

import org.ledavis.exchange.diagnostics.Part21SyntaxException;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * ISO-10303-21 物理文件的语法分析器（递归下降，单 token 前瞻）。
 * <pre>
 * file            := ISO ";" header dataSection "END-" ISO ";"
 * header          := "HEADER" ";" headerEntity+ "ENDSEC" ";"
 * headerEntity    := KEYWORD "(" parameter ("," parameter)* ")" ";"
 * dataSection     := "DATA" ";" entityInstance* "ENDSEC" ";"
 * entityInstance  := ID "=" (simpleRecord | "(" simpleRecord+ ")") ";"
 * simpleRecord    := KEYWORD "(" (parameter ("," parameter)*)? ")"
 * parameter       := typedParam | untypedParam | "*"
 * typedParam      := KEYWORD "(" parameter ")" | "(" ")"
 * untypedParam    := STRING | "$" | INT | REAL | ENUMERATION | ID | BINARY | list
 * list            := "(" parameter ("," parameter)* ")"
 * </pre>
 * 参数位置上的 {@code ()} 按空的类型参数处理（而不是空列表），与参考语法保持一致。
 * <p>
 * 失败策略：遇到第一个无法继续的 token 立即抛出 {@link Part21SyntaxException}，携带行/列、
 * 实际 token 以及此处可接受的终结符集合；不做任何错误恢复。
 */
public final class Part21Parser {

    private static final Set<TokenType> PARAMETER_START = EnumSet.of(
            TokenType.KEYWORD, TokenType.STRING, TokenType.DOLLAR, TokenType.INT, TokenType.REAL,
            TokenType.ENUMERATION, TokenType.ID, TokenType.BINARY, TokenType.LPAR, TokenType.STAR
    );

    private static final Set<TokenType> PARAMETER_OR_CLOSE = union(PARAMETER_START, TokenType.RPAR);

    private final Lexer lexer;
    private final SourceLines lines;
    private Token lookahead;

    public Part21Parser(Lexer lexer, SourceLines lines) {
        this.lexer = lexer;
        this.lines = lines;
    }

    /**
     * 一步完成预处理、词法与语法分析。
     */
    public static SyntaxNode parse(String source) {
        SourceLines lines = new SourceLines(source);
        return new Part21Parser(new Lexer(Preprocessor.normalize(source), lines), lines).parseFile();
    }

    public SyntaxNode parseFile() {
        List<SyntaxElement> children = new ArrayList<>();
        children.add(expect(TokenType.ISO));
        children.add(expect(TokenType.SEMICOLON));
        children.add(parseHeader());
        children.add(parseDataSection());
        children.add(expect(TokenType.END));
        children.add(expect(TokenType.ISO));
        children.add(expect(TokenType.SEMICOLON));
        expect(TokenType.EOF);
        return new SyntaxNode(Rule.FILE, children);
    }

    private SyntaxNode parseHeader() {
        List<SyntaxElement> children = new ArrayList<>();
        children.add(expect(TokenType.HEADER));
        children.add(expect(TokenType.SEMICOLON));
        children.add(parseHeaderEntity());
        while (peek().type() == TokenType.KEYWORD) {
            children.add(parseHeaderEntity());
        }
        children.add(expect(TokenType.ENDSEC, EnumSet.of(TokenType.KEYWORD, TokenType.ENDSEC)));
        children.add(expect(TokenType.SEMICOLON));
        return new SyntaxNode(Rule.HEADER, children);
    }

    private SyntaxNode parseHeaderEntity() {
        List<SyntaxElement> children = new ArrayList<>();
        children.add(expect(TokenType.KEYWORD));
        children.add(expect(TokenType.LPAR));
        parseParameterList(children, false);
        children.add(expect(TokenType.SEMICOLON));
        return new SyntaxNode(Rule.HEADER_ENTITY, children);
    }

    private SyntaxNode parseDataSection() {
        List<SyntaxElement> children = new ArrayList<>();
        children.add(expect(TokenType.DATA));
        children.add(expect(TokenType.SEMICOLON));
        while (peek().type() == TokenType.ID) {
            children.add(parseEntityInstance());
        }
        children.add(expect(TokenType.ENDSEC, EnumSet.of(TokenType.ID, TokenType.ENDSEC)));
        children.add(expect(TokenType.SEMICOLON));
        return new SyntaxNode(Rule.DATA_SECTION, children);
    }

    private SyntaxNode parseEntityInstance() {
        List<SyntaxElement> children = new ArrayList<>();
        children.add(checkRange(advance()));
        children.add(expect(TokenType.EQUAL));
        TokenType next = peek().type();
        if (next == TokenType.KEYWORD) {
            children.add(parseSimpleRecord());
        } else if (next == TokenType.LPAR) {
            children.add(parseSubsuperRecord());
        } else {
            throw unexpected(peek(), EnumSet.of(TokenType.KEYWORD, TokenType.LPAR));
        }
        children.add(expect(TokenType.SEMICOLON));
        return new SyntaxNode(Rule.ENTITY_INSTANCE, children);
    }

    private SyntaxNode parseSubsuperRecord() {
        List<SyntaxElement> children = new ArrayList<>();
        children.add(expect(TokenType.LPAR));
        if (peek().type() != TokenType.KEYWORD) {
            throw unexpected(peek(), EnumSet.of(TokenType.KEYWORD));
        }
        children.add(parseSimpleRecord());
        while (peek().type() == TokenType.KEYWORD) {
            children.add(parseSimpleRecord());
        }
        children.add(expect(TokenType.RPAR, EnumSet.of(TokenType.KEYWORD, TokenType.RPAR)));
        return new SyntaxNode(Rule.SUBSUPER_RECORD, children);
    }

    private SyntaxNode parseSimpleRecord() {
        List<SyntaxElement> children = new ArrayList<>();
        children.add(expect(TokenType.KEYWORD));
        children.add(expect(TokenType.LPAR));
        parseParameterList(children, true);
        return new SyntaxNode(Rule.SIMPLE_RECORD, children);
    }

    /**
     * 解析 "(" 之后的参数列表直到 ")"（含），结果追加到 {@code children}。
     */
    private void parseParameterList(List<SyntaxElement> children, boolean allowEmpty) {
        if (allowEmpty && peek().type() == TokenType.RPAR) {
            children.add(advance());
            return;
        }
        if (!PARAMETER_START.contains(peek().type())) {
            throw unexpected(peek(), allowEmpty ? PARAMETER_OR_CLOSE : PARAMETER_START);
        }
        children.add(parseParameter());
        while (true) {
            TokenType next = peek().type();
            if (next == TokenType.COMMA) {
                children.add(advance());
                children.add(parseParameter());
            } else if (next == TokenType.RPAR) {
                children.add(advance());
                return;
            } else {
                throw unexpected(peek(), EnumSet.of(TokenType.COMMA, TokenType.RPAR));
            }
        }
    }

    private SyntaxNode parseParameter() {
        Token next = peek();
        SyntaxNode inner;
        switch (next.type()) {
            case KEYWORD -> {
                List<SyntaxElement> typed = new ArrayList<>();
                typed.add(advance());
                typed.add(expect(TokenType.LPAR));
                typed.add(parseParameter());
                typed.add(expect(TokenType.RPAR));
                inner = new SyntaxNode(Rule.TYPED_PARAMETER, typed);
            }
            case LPAR -> {
                Token open = advance();
                if (peek().type() == TokenType.RPAR) {
                    inner = new SyntaxNode(Rule.TYPED_PARAMETER, List.of(open, advance()));
                } else {
                    List<SyntaxElement> list = new ArrayList<>();
                    list.add(open);
                    parseParameterList(list, true);
                    inner = new SyntaxNode(Rule.UNTYPED_PARAMETER, List.of(new SyntaxNode(Rule.LIST, list)));
                }
            }
            case STAR -> inner = new SyntaxNode(Rule.OMITTED_PARAMETER, List.of(advance()));
            case INT, ID, REAL -> inner = new SyntaxNode(Rule.UNTYPED_PARAMETER, List.of(checkRange(advance())));
            case STRING, DOLLAR, ENUMERATION, BINARY ->
                    inner = new SyntaxNode(Rule.UNTYPED_PARAMETER, List.of(advance()));
            default -> throw unexpected(next, PARAMETER_START);
        }
        return new SyntaxNode(Rule.PARAMETER, List.of(inner));
    }

    private Token peek() {
        if (lookahead == null) {
            lookahead = lexer.next();
        }
        return lookahead;
    }

    private Token advance() {
        Token current = peek();
        lookahead = null;
        return current;
    }

    private Token expect(TokenType type) {
        return expect(type, EnumSet.of(type));
    }

    /**
     * 只接受 {@code type}，但报错时报告 {@code reported} 中的全部终结符（此处语法上都可以出现）。
     */
    private Token expect(TokenType type, Set<TokenType> reported) {
        Token next = peek();
        if (next.type() != type) {
            throw unexpected(next, reported);
        }
        return advance();
    }

    // 整数与实例 id 需要能放进 64 位整数，实数必须是有限的 double
    private Token checkRange(Token token) {
        if (token.type() == TokenType.REAL) {
            if (!Double.isFinite(Double.parseDouble(token.text()))) {
                throw outOfRange(token, "a value within the double range");
            }
            return token;
        }
        String digits = (token.type() == TokenType.ID) ? token.text().substring(1) : token.text();
        try {
            Long.parseLong(digits);
        } catch (NumberFormatException e) {
            throw outOfRange(token, "a value within the 64-bit integer range");
        }
        return token;
    }

    private Part21SyntaxException outOfRange(Token token, String expectation) {
        return new Part21SyntaxException(
                Part21SyntaxException.Kind.UNEXPECTED_TOKEN,
                token.line(),
                token.column(),
                foundType(token),
                token.text(),
                List.of(),
                lines.line(token.line()),
                expectation
        );
    }

    private Part21SyntaxException unexpected(Token token, Set<TokenType> accepted) {
        List<String> expected = new ArrayList<>();
        for (TokenType type : accepted) {
            if (type.reported()) {
                expected.add(type.terminalName());
            }
        }
        expected.sort(null);
        Part21SyntaxException.Kind kind = (token.type() == TokenType.ERROR)
                ? Part21SyntaxException.Kind.UNEXPECTED_CHARACTER
                : Part21SyntaxException.Kind.UNEXPECTED_TOKEN;
        return new Part21SyntaxException(
                kind,
                token.line(),
                token.column(),
                foundType(token),
                token.text(),
                expected,
                lines.line(token.line()),
                null
        );
    }

    private static String foundType(Token token) {
        if (token.type() == TokenType.ERROR) {
            return "character";
        }
        return token.type().terminalName().toLowerCase(Locale.ROOT);
    }

    private static Set<TokenType> union(Set<TokenType> base, TokenType extra) {
        EnumSet<TokenType> out = EnumSet.copyOf(base);
        out.add(extra);
        return out;
    }
}
