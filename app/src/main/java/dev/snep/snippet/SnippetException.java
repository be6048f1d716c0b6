package dev.snep.snippet;

/**
 * A snippet library is inconsistent or a requirement cannot be satisfied.
 */
public class SnippetException extends RuntimeException {

    public SnippetException(String message) {
        super(message);
    }

    public SnippetException(String message, Throwable cause) {
        super(message, cause);
    }
}
