package com.morphirbridge.core.format;

import com.fasterxml.jackson.databind.JsonNode;
import com.morphirbridge.core.error.IrParseException;
import com.morphirbridge.core.model.Access;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Base class for the per-document readers the parsers create.
 *
 * <p>A reader lives for one parse call. It provides required-field navigation that reports
 * failures with the JSON pointer of the offending node, and it collects the cosmetic losses
 * seen while reading.
 */
public abstract class JsonDocumentReader {

    private final Set<CosmeticLoss> losses = EnumSet.noneOf(CosmeticLoss.class);

    public Set<CosmeticLoss> losses() {
        return losses;
    }

    protected void recordLoss(CosmeticLoss loss) {
        losses.add(loss);
    }

    // ==================== Navigation ====================

    protected static String pointer(String at, String key) {
        return at + "/" + key.replace("~", "~0").replace("/", "~1");
    }

    protected static String pointer(String at, int index) {
        return at + "/" + index;
    }

    protected static JsonNode field(JsonNode object, String name, String at) {
        JsonNode value = requireObject(object, at).get(name);
        if (value == null || value.isNull()) {
            throw new IrParseException(at, "missing field '" + name + "'");
        }
        return value;
    }

    protected static JsonNode optionalField(JsonNode object, String name) {
        JsonNode value = object == null ? null : object.get(name);
        return value == null || value.isNull() ? null : value;
    }

    protected static JsonNode element(JsonNode array, int index, String at) {
        requireArray(array, at);
        if (index >= array.size()) {
            throw new IrParseException(at, "expected at least " + (index + 1) + " elements but found " + array.size());
        }
        return array.get(index);
    }

    protected static JsonNode requireObject(JsonNode node, String at) {
        if (node == null || !node.isObject()) {
            throw new IrParseException(at, "expected an object but found " + describe(node));
        }
        return node;
    }

    protected static JsonNode requireArray(JsonNode node, String at) {
        if (node == null || !node.isArray()) {
            throw new IrParseException(at, "expected an array but found " + describe(node));
        }
        return node;
    }

    protected static String text(JsonNode node, String at) {
        if (node == null || !node.isTextual()) {
            throw new IrParseException(at, "expected a string but found " + describe(node));
        }
        return node.asText();
    }

    protected static String optionalText(JsonNode object, String name) {
        JsonNode value = optionalField(object, name);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    protected static Access access(JsonNode node, String at) {
        String text = text(node, at);
        return switch (text.toLowerCase(Locale.ROOT)) {
            case "public" -> Access.PUBLIC;
            case "private" -> Access.PRIVATE;
            default -> throw new IrParseException(at, "unknown access '" + text + "'");
        };
    }

    protected static String describe(JsonNode node) {
        if (node == null || node.isMissingNode()) {
            return "nothing";
        }
        return node.getNodeType().name().toLowerCase(Locale.ROOT);
    }

    /**
     * Converts a name-level {@link IllegalArgumentException} into a parse error at {@code at}.
     */
    protected static IrParseException invalid(String at, IllegalArgumentException e) {
        return new IrParseException(at, e.getMessage(), e);
    }

    /**
     * @return {@code true} if an attribute slot carries information
     */
    protected static boolean hasContent(JsonNode attributes) {
        return attributes != null && !attributes.isNull() && !attributes.isMissingNode()
            && !(attributes.isContainerNode() && attributes.isEmpty());
    }
}
