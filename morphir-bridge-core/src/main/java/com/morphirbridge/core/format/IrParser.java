package com.morphirbridge.core.format;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Service Provider Interface for IR version parsers.
 *
 * <p>Each parser owns one {@link IrVersion} and the detection clause for it. The clauses of the
 * registered parsers must be mutually exclusive: {@link FormatDetector} rejects a document that
 * no parser or more than one parser accepts.
 *
 * <p><b>Registration:</b> list implementations in
 * {@code META-INF/services/com.morphirbridge.core.format.IrParser}.
 *
 * <p>Implementations must be stateless; all per-document state lives in the call.
 */
public interface IrParser {

    IrVersion version();

    /**
     * Detection clause: does the document have this version's shape?
     *
     * <p>Must not throw for any well-formed JSON input.
     */
    boolean accepts(JsonNode root);

    /**
     * Parses a document this parser {@link #accepts(JsonNode) accepts}.
     *
     * @throws com.morphirbridge.core.error.IrParseException if the document is malformed
     */
    ParsedDistribution parse(JsonNode root);
}
