package org.ledavis.exchange.parser;

import org.junit.jupiter.api.Test;
import org.ledavis.exchange.model.CanonicalEntity;
import org.ledavis.exchange.model.CanonicalFile;
import org.ledavis.exchange.model.HeaderEntity;
import org.ledavis.exchange.model.SourceSpan;
import org.ledavis.exchange.model.Value;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.ledavis.exchange.Part21Samples.FIRST_DATA_LINE;
import static org.ledavis.exchange.Part21Samples.file;

class CanonicalizerTest {

    @Test
    void canonicalize_mapsEveryParameterKind() {
        CanonicalFile canonical = canonicalize(file("#1=FOO('a',1,2.5,$,*,.T.,#2,\"0ff\",(1,2),BAR(3),());"));

        CanonicalEntity entity = canonical.entities().get(0);
        assertThat(entity.id()).isEqualTo(1L);
        assertThat(entity.body()).isEqualTo(new Value.SimpleRecord("FOO", List.of(
                new Value.Str("a"),
                new Value.Int(1),
                new Value.Real(2.5),
                Value.NONE,
                Value.OMITTED,
                new Value.Enumeration("T"),
                new Value.Ref(2),
                new Value.Binary(0, "FF"),
                new Value.Aggregate(List.of(new Value.Int(1), new Value.Int(2))),
                new Value.Typed("BAR", new Value.Int(3)),
                new Value.Str("")
        )));
    }

    @Test
    void canonicalize_keepsComplexRecordOrder() {
        CanonicalFile canonical = canonicalize(file("#2=(A(1)B(#1)C());"));

        assertThat(canonical.entities().get(0).body()).isEqualTo(new Value.ComplexRecord(List.of(
                new Value.SimpleRecord("A", List.of(new Value.Int(1))),
                new Value.SimpleRecord("B", List.of(new Value.Ref(1))),
                new Value.SimpleRecord("C", List.of())
        )));
    }

    @Test
    void canonicalize_decodesStrings() {
        CanonicalFile canonical = canonicalize(file("#1=NAME('\\X2\\4E2D6587\\X0\\','it''s');"));

        Value.SimpleRecord record = (Value.SimpleRecord) canonical.entities().get(0).body();
        assertThat(record.parameters()).containsExactly(new Value.Str("中文"), new Value.Str("it's"));
    }

    @Test
    void canonicalize_recordsSourceSpans() {
        CanonicalFile canonical = canonicalize(file("#1=FOO(", "1,", "2);", "#2=BAR();"));

        assertThat(canonical.entities().get(0).span()).isEqualTo(new SourceSpan(FIRST_DATA_LINE, FIRST_DATA_LINE + 2));
        assertThat(canonical.entities().get(1).span()).isEqualTo(SourceSpan.ofLine(FIRST_DATA_LINE + 3));
    }

    @Test
    void canonicalize_collectsHeaderEntities() {
        CanonicalFile canonical = canonicalize(file());

        assertThat(canonical.header()).extracting(HeaderEntity::keyword)
                .containsExactly("FILE_DESCRIPTION", "FILE_NAME", "FILE_SCHEMA");
        assertThat(canonical.header().get(2).parameters())
                .containsExactly(new Value.Aggregate(List.of(new Value.Str("AUTOMOTIVE_DESIGN"))));
    }

    private static CanonicalFile canonicalize(String source) {
        return Canonicalizer.canonicalize(Part21Parser.parse(source));
    }
}
