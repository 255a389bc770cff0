package org.ledavis.exchange.files;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SecurePathResolverTest {

    @TempDir
    Path root;

    @Test
    void resolveExisting_relativeToDefaultRoot() throws Exception {
        Files.createDirectories(root.resolve("models"));
        Files.writeString(root.resolve("models/a.stp"), "x");
        SecurePathResolver resolver = new SecurePathResolver(List.of(root.toString()), false);

        SecurePathResolver.ResolvedPath resolved = resolver.resolveExisting(null, "models/a.stp");

        assertThat(resolved.rootId()).isEqualTo("root0");
        assertThat(resolved.displayPath()).isEqualTo("models/a.stp");
        assertThat(resolved.absolutePath()).isEqualTo(root.resolve("models/a.stp").toAbsolutePath().normalize());
    }

    @Test
    void resolveExisting_rejectsTraversalAndMissingFiles() {
        SecurePathResolver resolver = new SecurePathResolver(List.of(root.toString()), false);

        assertThatThrownBy(() -> resolver.resolveExisting(null, "../outside.stp"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> resolver.resolveExisting(null, "missing.stp"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> resolver.resolveExisting("root7", "a.stp"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void resolveForWrite_needsExistingParentDirectory() {
        SecurePathResolver resolver = new SecurePathResolver(List.of(root.toString()), false);

        assertThat(resolver.resolveForWrite(null, "graph.html").displayPath()).isEqualTo("graph.html");
        assertThatThrownBy(() -> resolver.resolveForWrite(null, "out/graph.html"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void listRoots_assignsSequentialIds(@TempDir Path other) {
        SecurePathResolver resolver = new SecurePathResolver(List.of(root.toString(), other.toString()), false);

        assertThat(resolver.listRoots()).extracting(r -> r.id()).containsExactly("root0", "root1");
    }
}
