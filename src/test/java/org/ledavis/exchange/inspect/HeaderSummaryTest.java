package org.ledavis.exchange.inspect;

import org.junit.jupiter.api.Test;
import org.ledavis.exchange.Part21Reader;
import org.ledavis.exchange.model.ExchangeModel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.ledavis.exchange.Part21Samples.file;

class HeaderSummaryTest {

    @Test
    void of_readsStandardHeaderRecords() {
        HeaderSummary summary = HeaderSummary.of(Part21Reader.parse(file()));

        assertThat(summary.fileDescriptions()).containsExactly("demo");
        assertThat(summary.implementationLevel()).isEqualTo("2;1");
        assertThat(summary.fileName()).isEqualTo("demo.stp");
        assertThat(summary.timeStamp()).isEqualTo("2024-01-01T00:00:00");
        assertThat(summary.authors()).containsExactly("alice");
        assertThat(summary.organizations()).containsExactly("acme");
        assertThat(summary.preprocessorVersion()).isEqualTo("pre 1.0");
        assertThat(summary.originatingSystem()).isEqualTo("cad 2.0");
        assertThat(summary.authorization()).isEmpty();
        assertThat(summary.schemas()).containsExactly("AUTOMOTIVE_DESIGN");
        assertThat(summary.warnings()).isNull();
    }

    @Test
    void of_decodesEscapedStrings() {
        String source = """
                ISO-10303-21;
                HEADER;
                FILE_DESCRIPTION(('\\X2\\4E2D65876A21578B\\X0\\'),'2;1');
                FILE_NAME('O''Reilly.stp','t',('\\X2\\4F5C8005\\X0\\'),(''),$,'s','');
                FILE_SCHEMA(('AP214','AP242'));
                ENDSEC;
                DATA;
                ENDSEC;
                END-ISO-10303-21;
                """;

        HeaderSummary summary = HeaderSummary.of(Part21Reader.parse(source));

        assertThat(summary.fileDescriptions()).containsExactly("中文模型");
        assertThat(summary.fileName()).isEqualTo("O'Reilly.stp");
        assertThat(summary.authors()).containsExactly("作者");
        assertThat(summary.organizations()).containsExactly("");
        assertThat(summary.preprocessorVersion()).isNull();
        assertThat(summary.schemas()).containsExactly("AP214", "AP242");
    }

    @Test
    void of_warnsAboutMissingRecords() {
        ExchangeModel model = Part21Reader.parse(
                "ISO-10303-21;\nHEADER;\nFILE_DESCRIPTION(('x'),'1');\nENDSEC;\nDATA;\nENDSEC;\nEND-ISO-10303-21;\n");

        HeaderSummary summary = HeaderSummary.of(model);

        assertThat(summary.fileDescriptions()).containsExactly("x");
        assertThat(summary.fileName()).isNull();
        assertThat(summary.schemas()).isNull();
        assertThat(summary.warnings()).anyMatch(w -> w.contains("FILE_NAME")).anyMatch(w -> w.contains("FILE_SCHEMA"));
    }
}
