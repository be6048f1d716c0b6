package dev.snep.parse;

/**
 * Malformed directive input. Aborts the whole parse.
 */
public class ParseException extends RuntimeException {

    private final String source;
    private final int line;
    private final String detail;

    public ParseException(String source, int line, String detail) {
        super((source == null ? "<input>" : source) + ":" + line + ": " + detail);
        this.source = source;
        this.line = line;
        this.detail = detail;
    }

    public String source() {
        return source;
    }

    public int line() {
        return line;
    }

    public String detail() {
        return detail;
    }
}
