package org.ledavis.exchange.model;

import org.junit.jupiter.api.Test;
import org.ledavis.exchange.Part21Reader;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.ledavis.exchange.Part21Samples.file;

class ValueFormatterTest {

    @Test
    void format_rendersPart21Text() {
        Value record = new Value.SimpleRecord("FOO", List.of(
                new Value.Str("it's"),
                new Value.Real(1.5),
                new Value.Enumeration("T"),
                new Value.Ref(3),
                new Value.Binary(2, "AB"),
                Value.NONE,
                Value.OMITTED,
                new Value.Typed("LENGTH", new Value.Int(-4)),
                new Value.Aggregate(List.of(new Value.Int(1), new Value.Int(2)))
        ));

        assertThat(ValueFormatter.format(record))
                .isEqualTo("FOO('it''s', 1.5, .T., #3, \"2AB\", $, *, LENGTH(-4), (1, 2))");
    }

    @Test
    void format_complexRecordKeepsMembersTogether() {
        Value complex = new Value.ComplexRecord(List.of(
                new Value.SimpleRecord("A", List.of()),
                new Value.SimpleRecord("B", List.of(new Value.Int(1)))
        ));

        assertThat(ValueFormatter.format(complex)).isEqualTo("(A()B(1))");
    }

    @Test
    void format_reparsesToTheSameValue() {
        String source = "#1=FOO('it''s',1.5,-3,1.0E-5,.T.,#3,\"2AB\",(1,(2,$)),BAR(*),'\\X2\\4E2D\\X0\\','a\\\\b');";
        Value body = Part21Reader.parse(file(source)).get(1).body();

        String rendered = "#1=" + ValueFormatter.format(body) + ";";
        Value reparsed = Part21Reader.parse(file(rendered)).get(1).body();

        assertThat(reparsed).isEqualTo(body);
    }

    @Test
    void format_complexRecordReparses() {
        Value body = Part21Reader.parse(file("#5=(A(#1)B('x',2.));")).get(5).body();

        Value reparsed = Part21Reader.parse(file("#5=" + ValueFormatter.format(body) + ";")).get(5).body();

        assertThat(reparsed).isEqualTo(body);
    }
}
