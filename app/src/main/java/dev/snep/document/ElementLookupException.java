package dev.snep.document;

/**
 * Raised when a child element cannot be addressed by name.
 */
public abstract class ElementLookupException extends RuntimeException {

    private final String elementName;

    protected ElementLookupException(String message, String elementName) {
        super(message);
        this.elementName = elementName;
    }

    public String elementName() {
        return elementName;
    }
}
