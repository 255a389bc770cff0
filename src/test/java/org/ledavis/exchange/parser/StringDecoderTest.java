package org.ledavis.exchange.parser;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StringDecoderTest {

    @Test
    void decode_x2Unicode() {
        assertThat(StringDecoder.decode("\\X2\\4E2D6587\\X0\\")).isEqualTo("中文");
    }

    @Test
    void decode_x4Unicode() {
        assertThat(StringDecoder.decode("\\X4\\0001F600\\X0\\")).isEqualTo(new String(Character.toChars(0x1F600)));
    }

    @Test
    void decode_singleByteHex() {
        assertThat(StringDecoder.decode("caf\\X\\E9")).isEqualTo("café");
    }

    @Test
    void decode_quotesAndBackslashes() {
        assertThat(StringDecoder.decode("O''Reilly")).isEqualTo("O'Reilly");
        assertThat(StringDecoder.decode("a\\\\b")).isEqualTo("a\\b");
    }

    @Test
    void decode_codePageSwitch() {
        assertThat(StringDecoder.decode("\\S\\D")).isEqualTo("Ä");
        assertThat(StringDecoder.decode("\\PB\\\\S\\1")).isEqualTo("ą");
    }

    @Test
    void decode_dropsLineBreaks() {
        assertThat(StringDecoder.decode("ab\r\ncd")).isEqualTo("abcd");
    }

    @Test
    void decode_keepsUnknownBackslash() {
        assertThat(StringDecoder.decode("C:\\temp")).isEqualTo("C:\\temp");
    }
}
