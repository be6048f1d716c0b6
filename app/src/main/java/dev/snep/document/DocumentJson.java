package dev.snep.document;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * JSON projection of a document tree, for inspection only.
 *
 * <pre>
 *   text      = "some text\n"
 *   attribute = ["name", "value"]
 *   element   = ["name" | null, [node, ...]]
 * </pre>
 *
 * Origins and trailing comments are not part of the projection.
 */
public final class DocumentJson {

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private DocumentJson() {
    }

    public static JsonNode toJson(Node node) {
        if (node instanceof Text text) {
            return NODES.textNode(text.value());
        }
        if (node instanceof Attribute attribute) {
            ArrayNode pair = NODES.arrayNode();
            pair.add(attribute.name());
            pair.add(attribute.value());
            return pair;
        }
        if (node instanceof Element element) {
            ArrayNode result = NODES.arrayNode();
            if (element.isRoot()) {
                result.addNull();
            } else {
                result.add(element.name().orElseThrow());
            }
            ArrayNode children = result.addArray();
            for (Node child : element.children()) {
                children.add(toJson(child));
            }
            return result;
        }
        throw new IllegalArgumentException("Unsupported node type: " + node.getClass().getName());
    }

    public static String write(Node node, boolean pretty) {
        JsonNode json = toJson(node);
        try {
            return pretty
                    ? JSON.writerWithDefaultPrettyPrinter().writeValueAsString(json)
                    : JSON.writeValueAsString(json);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize document as JSON", ex);
        }
    }
}
