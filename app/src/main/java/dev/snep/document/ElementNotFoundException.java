package dev.snep.document;

/**
 * No child element carries the requested name.
 */
public class ElementNotFoundException extends ElementLookupException {

    public ElementNotFoundException(String elementName) {
        super("element does not exist: " + elementName, elementName);
    }
}
