package org.ledavis.exchange.diagnostics;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.ledavis.exchange.model.SourceSpan;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DiagnosticFormatterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void formatSyntax_pointsCaretAtColumn() {
        Part21SyntaxException e = new Part21SyntaxException(
                Part21SyntaxException.Kind.UNEXPECTED_TOKEN, 8, 8, "semicolon", ";",
                List.of("COMMA", "RPAR"), "#1=FOO(;", null);

        assertThat(e.getMessage()).isEqualTo(
                "On line 8 column 8:\n"
                        + "Unexpected semicolon (';')\n"
                        + "Expecting one of COMMA RPAR\n"
                        + "00008 | #1=FOO(;\n"
                        + "               ^");
    }

    @Test
    void formatSyntax_singleExpectationIsNamedDirectly() {
        Part21SyntaxException e = new Part21SyntaxException(
                Part21SyntaxException.Kind.UNEXPECTED_CHARACTER, 12, 1, "character", "@",
                List.of("SEMICOLON"), "@", null);

        assertThat(e.getMessage()).contains("Unexpected character ('@')\nExpecting SEMICOLON\n00012 | @\n        ^");
    }

    @Test
    void formatDuplicate_underlinesWholeLine() {
        DuplicateNameException e = new DuplicateNameException("#1", SourceSpan.ofLine(10), "#1=BAR();  ");

        assertThat(e.getMessage()).isEqualTo(
                "On line 10:\n"
                        + "Duplicate instance name #1\n"
                        + "00010 | #1=BAR();  \n"
                        + "        ^^^^^^^^^");
    }

    @Test
    void toDiagnostic_syntaxRecordSerializesWithSnakeCaseKeys() throws Exception {
        Part21SyntaxException e = new Part21SyntaxException(
                Part21SyntaxException.Kind.UNEXPECTED_TOKEN, 8, 8, "semicolon", ";",
                List.of("COMMA", "RPAR"), "#1=FOO(;", null);

        String json = objectMapper.writeValueAsString(e.toDiagnostic(false));

        assertThat(json).isEqualTo("{\"type\":\"unexpected_token\",\"lineno\":8,\"column\":8,"
                + "\"found_type\":\"semicolon\",\"found_value\":\";\",\"expected\":[\"COMMA\",\"RPAR\"],"
                + "\"line\":\"#1=FOO(;\"}");
    }

    @Test
    void toDiagnostic_duplicateRecordOmitsSyntaxFields() throws Exception {
        DuplicateNameException e = new DuplicateNameException("#1", SourceSpan.ofLine(10), "#1=BAR();");

        String json = objectMapper.writeValueAsString(e.toDiagnostic());

        assertThat(json).startsWith("{\"type\":\"duplicate_name\",\"name\":\"#1\",\"lineno\":10,\"line\":\"#1=BAR();\",\"message\":");
        assertThat(json).doesNotContain("column", "expected");
    }
}
