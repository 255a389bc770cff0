package org.ledavis.exchange.files;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExchangeFileReaderTest {

    @TempDir
    Path dir;

    @Test
    void read_utf8() throws Exception {
        Path file = dir.resolve("a.stp");
        Files.writeString(file, "'中文'", StandardCharsets.UTF_8);

        ExchangeFileReader.DecodedText decoded = new ExchangeFileReader(1024).read(file);

        assertThat(decoded.text()).isEqualTo("'中文'");
        assertThat(decoded.decodedWith()).isEqualTo("UTF-8");
        assertThat(decoded.warnings()).isEmpty();
    }

    @Test
    void read_fallsBackToGb18030() throws Exception {
        Path file = dir.resolve("b.stp");
        Files.write(file, "'中文'".getBytes(Charset.forName("GB18030")));

        ExchangeFileReader.DecodedText decoded = new ExchangeFileReader(1024).read(file);

        assertThat(decoded.text()).isEqualTo("'中文'");
        assertThat(decoded.decodedWith()).isEqualTo("GB18030");
        assertThat(decoded.warnings()).hasSize(1);
    }

    @Test
    void read_rejectsOversizedAndMissingFiles() throws Exception {
        Path file = dir.resolve("c.stp");
        Files.writeString(file, "0123456789");

        assertThatThrownBy(() -> new ExchangeFileReader(4).read(file))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("文件过大");
        assertThatThrownBy(() -> new ExchangeFileReader(4).read(dir.resolve("missing.stp")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ExchangeFileReader(1024).read(dir))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
