package dev.snep.writer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Saves rendered documents so that a target is either fully replaced or left untouched.
 *
 * <p>Content goes to a temporary file next to the target, which is then moved over it.
 */
public class DocumentWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentWriter.class);
    private static final String TEMP_SUFFIX = ".tmpsave~";

    public void write(Path target, String content) {
        if (target == null || content == null) {
            throw new IllegalArgumentException("target and content must be provided");
        }
        Path absolute = target.toAbsolutePath();
        Path directory = absolute.getParent();
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, ".#" + absolute.getFileName() + ".", TEMP_SUFFIX);
            Files.writeString(temp, content, StandardCharsets.UTF_8, StandardOpenOption.TRUNCATE_EXISTING);
            move(temp, absolute);
            temp = null;
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write document: " + target, ex);
        } finally {
            if (temp != null) {
                deleteQuietly(temp);
            }
        }
    }

    /**
     * Writes {@code content} unless the target already holds exactly that text.
     *
     * @return whether the target was written
     */
    public boolean writeIfChanged(Path target, String content) {
        if (target == null || content == null) {
            throw new IllegalArgumentException("target and content must be provided");
        }
        try {
            if (Files.isRegularFile(target) && Files.readString(target, StandardCharsets.UTF_8).equals(content)) {
                LOGGER.debug("Unchanged: {}", target);
                return false;
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read document: " + target, ex);
        }
        write(target, content);
        return true;
    }

    private void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            LOGGER.debug("Atomic move not supported for {}, replacing instead", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException ex) {
            LOGGER.warn("Failed to remove temporary file {}", temp, ex);
        }
    }
}
