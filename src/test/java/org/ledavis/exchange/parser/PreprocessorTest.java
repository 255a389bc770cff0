package org.ledavis.exchange.parser;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PreprocessorTest {

    @Test
    void normalize_removesCommentsButKeepsTheirNewlines() {
        NormalizedText normalized = Preprocessor.normalize("A /* x\ny */ B");

        assertThat(normalized.text()).isEqualTo("A\nB");
        assertThat(normalized.sourceOffsets()).containsExactly(0, 6, 12, 13);
    }

    @Test
    void normalize_leavesStringsUntouched() {
        NormalizedText normalized = Preprocessor.normalize("'a b /* c */'  X");

        assertThat(normalized.text()).isEqualTo("'a b /* c */'X");
    }

    @Test
    void normalize_pageDirectiveQuoteStaysInsideString() {
        NormalizedText normalized = Preprocessor.normalize("'\\S\\'', 'a b'");

        assertThat(normalized.text()).isEqualTo("'\\S\\'','a b'");
    }

    @Test
    void normalize_escapedBackslashBeforeClosingQuote() {
        NormalizedText normalized = Preprocessor.normalize("'a\\\\' , 'b c'");

        assertThat(normalized.text()).isEqualTo("'a\\\\','b c'");
    }

    @Test
    void normalize_removesWhitespaceOtherThanNewlines() {
        assertThat(Preprocessor.normalize("A\t\r\nB \f C").text()).isEqualTo("A\nBC");
    }

    @Test
    void normalize_keepsUnterminatedCommentForTheParserToReport() {
        assertThat(Preprocessor.normalize("A /* B").text()).isEqualTo("A/*B");
    }

    @Test
    void normalize_nullIsEmpty() {
        NormalizedText normalized = Preprocessor.normalize(null);

        assertThat(normalized.text()).isEmpty();
        assertThat(normalized.sourceOffset(0)).isZero();
    }
}
