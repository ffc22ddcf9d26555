package com.morphirbridge.core.format;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.morphirbridge.core.error.IrParseException;

import java.nio.charset.StandardCharsets;

/**
 * Shared Jackson setup for reading and writing IR documents.
 */
public final class IrJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private IrJson() {
        // Utility class
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Parses JSON text.
     *
     * @param sourcePath where the text came from, used in the error message
     * @throws IrParseException if the text is not well-formed JSON
     */
    public static JsonNode read(String text, String sourcePath) {
        try {
            JsonNode node = MAPPER.readTree(text);
            if (node == null || node.isMissingNode()) {
                throw new IrParseException("", "document is empty").inFile(sourcePath);
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new IrParseException("", "malformed JSON: " + e.getOriginalMessage(), e).inFile(sourcePath);
        }
    }

    public static JsonNode read(byte[] content, String sourcePath) {
        return read(new String(content, StandardCharsets.UTF_8), sourcePath);
    }

    public static byte[] toPrettyBytes(JsonNode node) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsBytes(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("tree nodes always serialize", e);
        }
    }

    public static ObjectNode object() {
        return NODES.objectNode();
    }

    public static ArrayNode array() {
        return NODES.arrayNode();
    }
}
