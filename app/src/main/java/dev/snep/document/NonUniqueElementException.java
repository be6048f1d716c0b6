package dev.snep.document;

/**
 * Two or more child elements carry the requested name.
 */
public class NonUniqueElementException extends ElementLookupException {

    private final int occurrences;

    public NonUniqueElementException(String elementName, int occurrences) {
        super("element is not unique: " + elementName + " (" + occurrences + " occurrences)", elementName);
        this.occurrences = occurrences;
    }

    public int occurrences() {
        return occurrences;
    }
}
