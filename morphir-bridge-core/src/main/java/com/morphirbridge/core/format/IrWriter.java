package com.morphirbridge.core.format;

import com.fasterxml.jackson.databind.JsonNode;
import com.morphirbridge.core.model.Distribution;

/**
 * Encodes a canonical distribution as a single JSON document of one version.
 */
public interface IrWriter {

    IrVersion version();

    /**
     * @throws com.morphirbridge.core.error.MigrationUnsupportedException if the distribution holds a
     *         construct this version cannot express
     */
    JsonNode write(Distribution distribution);
}
