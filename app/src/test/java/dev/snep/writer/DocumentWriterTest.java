package dev.snep.writer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DocumentWriterTest {

    @TempDir
    Path tempDir;

    private final DocumentWriter writer = new DocumentWriter();

    @Test
    void writesContentAndCreatesDirectories() throws Exception {
        Path target = tempDir.resolve("nested/dir/out.sh");

        writer.write(target, "#@snips[\n#@]\n");

        assertThat(Files.readString(target, StandardCharsets.UTF_8)).isEqualTo("#@snips[\n#@]\n");
        assertThat(listing(target.getParent())).containsExactly("out.sh");
    }

    @Test
    void replacesExistingContentWithoutLeavingTemporaryFiles() throws Exception {
        Path target = tempDir.resolve("out.sh");
        Files.writeString(target, "old content that is longer\n", StandardCharsets.UTF_8);

        writer.write(target, "new\n");

        assertThat(Files.readString(target, StandardCharsets.UTF_8)).isEqualTo("new\n");
        assertThat(listing(tempDir)).containsExactly("out.sh");
    }

    @Test
    void skipsUnchangedContent() throws Exception {
        Path target = tempDir.resolve("out.sh");

        assertThat(writer.writeIfChanged(target, "a\n")).isTrue();
        assertThat(writer.writeIfChanged(target, "a\n")).isFalse();
        assertThat(writer.writeIfChanged(target, "b\n")).isTrue();
        assertThat(Files.readString(target, StandardCharsets.UTF_8)).isEqualTo("b\n");
    }

    @Test
    void rejectsMissingArguments() {
        assertThatThrownBy(() -> writer.write(null, "x"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must be provided");
    }

    private static List<String> listing(Path directory) throws Exception {
        try (Stream<Path> files = Files.list(directory)) {
            return files.map(path -> path.getFileName().toString()).collect(Collectors.toList());
        }
    }
}
