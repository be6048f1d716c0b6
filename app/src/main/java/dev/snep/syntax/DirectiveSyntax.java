package dev.snep.syntax;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Comment syntax used to mark directive lines inside a host language.
 *
 * <p>A directive line starts (after optional indentation) with {@link #prefix()} and, for block comment
 * syntaxes, ends with {@link #suffix()}. A space in the prefix matches any single whitespace character,
 * so {@code "--\t@"} is accepted for {@link #HS}; rendering always writes the prefix as declared.
 */
public record DirectiveSyntax(String name, String prefix, String suffix) {

    public static final DirectiveSyntax SH = new DirectiveSyntax("sh", "#@", "");
    public static final DirectiveSyntax CPP = new DirectiveSyntax("c++", "//@", "");
    public static final DirectiveSyntax C = new DirectiveSyntax("c", "/*@", "*/");
    public static final DirectiveSyntax HS = new DirectiveSyntax("hs", "-- @", "");
    public static final DirectiveSyntax HS_BLOCK = new DirectiveSyntax("hs-block", "{-@", "-}");

    private static final List<DirectiveSyntax> BUILT_IN = List.of(SH, CPP, C, HS, HS_BLOCK);

    public DirectiveSyntax {
        name = requireNonBlank(name, "name");
        prefix = requireNonBlank(prefix, "prefix");
        suffix = suffix == null ? "" : suffix;
    }

    public static DirectiveSyntax defaultSyntax() {
        return SH;
    }

    public static List<DirectiveSyntax> builtIn() {
        return BUILT_IN;
    }

    public static DirectiveSyntax forName(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Syntax name must be provided");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (DirectiveSyntax syntax : builtIn()) {
            if (syntax.name().equals(normalized)) {
                return syntax;
            }
        }
        throw new IllegalArgumentException("Unsupported syntax: " + raw);
    }

    /**
     * Extracts the directive body from a raw line.
     *
     * @param line the raw line, with or without its terminator
     * @return the body with the marker, the closing suffix and surrounding whitespace removed, or empty
     *     when the line carries no marker
     */
    public Optional<String> directiveBody(String line) {
        String content = stripTerminator(line);
        int start = 0;
        while (start < content.length() && Character.isWhitespace(content.charAt(start))) {
            start++;
        }
        if (!prefixAt(content, start)) {
            return Optional.empty();
        }
        String body = stripTrailing(content.substring(start + prefix.length()));
        if (!suffix.isEmpty() && body.endsWith(suffix)) {
            body = stripTrailing(body.substring(0, body.length() - suffix.length()));
        }
        return Optional.of(body.stripLeading());
    }

    private boolean prefixAt(String content, int start) {
        if (content.length() - start < prefix.length()) {
            return false;
        }
        for (int i = 0; i < prefix.length(); i++) {
            char expected = prefix.charAt(i);
            char actual = content.charAt(start + i);
            boolean matches = expected == ' ' ? Character.isWhitespace(actual) : expected == actual;
            if (!matches) {
                return false;
            }
        }
        return true;
    }

    public String directiveLine(String body) {
        return prefix + body + suffix + "\n";
    }

    private static String stripTerminator(String line) {
        int end = line.length();
        while (end > 0 && line.charAt(end - 1) == '\n') {
            end--;
        }
        return line.substring(0, end);
    }

    private static String stripTrailing(String value) {
        int end = value.length();
        while (end > 0 && Character.isWhitespace(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(0, end);
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}
