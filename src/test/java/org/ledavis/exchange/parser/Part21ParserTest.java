package org.ledavis.exchange.parser;

import org.junit.jupiter.api.Test;
import org.ledavis.exchange.diagnostics.Part21SyntaxException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.ledavis.exchange.Part21Samples.FIRST_DATA_LINE;
import static org.ledavis.exchange.Part21Samples.file;

class Part21ParserTest {

    @Test
    void parse_buildsHeaderAndDataNodes() {
        SyntaxNode tree = Part21Parser.parse(file("#1=FOO(1,'a');", "#2=(A()B(#1));"));

        assertThat(tree.rule()).isEqualTo(Rule.FILE);
        SyntaxNode header = tree.nodes(Rule.HEADER).get(0);
        assertThat(header.nodes(Rule.HEADER_ENTITY)).hasSize(3);
        SyntaxNode data = tree.nodes(Rule.DATA_SECTION).get(0);
        assertThat(data.nodes(Rule.ENTITY_INSTANCE)).hasSize(2);
        assertThat(data.nodes(Rule.ENTITY_INSTANCE).get(1).nodes(Rule.SUBSUPER_RECORD)).hasSize(1);
    }

    @Test
    void parse_acceptsEmptyDataSection() {
        SyntaxNode tree = Part21Parser.parse(file());

        assertThat(tree.nodes(Rule.DATA_SECTION).get(0).nodes(Rule.ENTITY_INSTANCE)).isEmpty();
    }

    @Test
    void parse_missingCloseParenPointsAtSemicolon() {
        Part21SyntaxException e = syntaxError(file("#1=FOO(;"));

        assertThat(e.kind()).isEqualTo(Part21SyntaxException.Kind.UNEXPECTED_TOKEN);
        assertThat(e.lineNumber()).isEqualTo(FIRST_DATA_LINE);
        assertThat(e.column()).isEqualTo(8);
        assertThat(e.foundType()).isEqualTo("semicolon");
        assertThat(e.foundValue()).isEqualTo(";");
        assertThat(e.expected()).containsExactly(
                "BINARY", "DOLLAR", "ENUMERATION", "ID", "INT", "KEYWORD", "LPAR", "REAL", "RPAR", "STAR", "STRING");
        assertThat(e.lineText()).isEqualTo("#1=FOO(;");
    }

    @Test
    void parse_columnsIgnoreRemovedWhitespace() {
        Part21SyntaxException e = syntaxError(file("#1 = FOO( ;"));

        assertThat(e.column()).isEqualTo(11);
        assertThat(e.lineText()).isEqualTo("#1 = FOO( ;");
    }

    @Test
    void parse_unknownCharacterIsReportedAsCharacter() {
        Part21SyntaxException e = syntaxError(file("#1=FOO(@);"));

        assertThat(e.kind()).isEqualTo(Part21SyntaxException.Kind.UNEXPECTED_CHARACTER);
        assertThat(e.foundType()).isEqualTo("character");
        assertThat(e.foundValue()).isEqualTo("@");
        assertThat(e.column()).isEqualTo(8);
    }

    @Test
    void parse_missingSeparatorExpectsCommaOrClose() {
        Part21SyntaxException e = syntaxError(file("#1=FOO(1'a');"));

        assertThat(e.expected()).containsExactly("COMMA", "RPAR");
    }

    @Test
    void parse_headerEntityNeedsParameters() {
        String source = "ISO-10303-21;\nHEADER;\nFILE_SCHEMA();\nENDSEC;\nDATA;\nENDSEC;\nEND-ISO-10303-21;\n";

        Part21SyntaxException e = syntaxError(source);

        assertThat(e.lineNumber()).isEqualTo(3);
        assertThat(e.expected()).doesNotContain("RPAR").contains("STRING", "LPAR");
    }

    @Test
    void parse_integerOutOfRangeIsRejected() {
        Part21SyntaxException e = syntaxError(file("#1=FOO(99999999999999999999);"));

        assertThat(e.expected()).isEmpty();
        assertThat(e.getMessage()).contains("Expecting a value within the 64-bit integer range");
    }

    @Test
    void parse_realOutOfRangeIsRejected() {
        Part21SyntaxException e = syntaxError(file("#1=FOO(1.0E400);"));

        assertThat(e.column()).isEqualTo(8);
        assertThat(e.foundValue()).isEqualTo("1.0E400");
        assertThat(e.expected()).isEmpty();
        assertThat(e.getMessage()).contains("Expecting a value within the double range");
    }

    @Test
    void parse_acceptsLargeFiniteReal() {
        SyntaxNode tree = Part21Parser.parse(file("#1=FOO(1.0E300,-2.5E-320);"));

        assertThat(tree.nodes(Rule.DATA_SECTION).get(0).nodes(Rule.ENTITY_INSTANCE)).hasSize(1);
    }

    @Test
    void parse_rejectsTrailingContent() {
        assertThatThrownBy(() -> Part21Parser.parse(file() + "DATA;"))
                .isInstanceOf(Part21SyntaxException.class)
                .hasMessageContaining("Expecting $END");
    }

    @Test
    void parse_unterminatedCommentFails() {
        assertThatThrownBy(() -> Part21Parser.parse(file("/* open", "#1=FOO();")))
                .isInstanceOf(Part21SyntaxException.class);
    }

    private static Part21SyntaxException syntaxError(String source) {
        try {
            Part21Parser.parse(source);
        } catch (Part21SyntaxException e) {
            return e;
        }
        throw new AssertionError("expected a syntax error");
    }
}
