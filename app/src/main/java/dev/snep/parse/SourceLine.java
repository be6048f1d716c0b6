package dev.snep.parse;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * A raw input line with its 1-based line number. The text keeps its line terminator.
 */
public record SourceLine(int number, String text) {

    public SourceLine {
        if (number < 1) {
            throw new IllegalArgumentException("Line numbers start at 1");
        }
        Objects.requireNonNull(text, "text");
    }

    /**
     * Lazily splits character input into numbered lines. {@code "\n"} terminates a line and stays part
     * of it; a final line without terminator is kept as is.
     */
    public static Iterator<SourceLine> lines(Reader reader) {
        BufferedReader input = reader instanceof BufferedReader buffered ? buffered : new BufferedReader(reader);
        return new Iterator<>() {
            private int number;
            private String pending;
            private boolean exhausted;

            @Override
            public boolean hasNext() {
                if (pending == null && !exhausted) {
                    pending = readLine();
                    exhausted = pending == null;
                }
                return pending != null;
            }

            @Override
            public SourceLine next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                String line = pending;
                pending = null;
                return new SourceLine(++number, line);
            }

            private String readLine() {
                try {
                    StringBuilder line = new StringBuilder();
                    int ch;
                    while ((ch = input.read()) != -1) {
                        line.append((char) ch);
                        if (ch == '\n') {
                            break;
                        }
                    }
                    return line.length() == 0 ? null : line.toString();
                } catch (IOException ex) {
                    throw new UncheckedIOException("Failed to read document input", ex);
                }
            }
        };
    }
}
