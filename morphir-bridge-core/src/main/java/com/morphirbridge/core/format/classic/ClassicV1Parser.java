package com.morphirbridge.core.format.classic;

import com.fasterxml.jackson.databind.JsonNode;
import com.morphirbridge.core.format.IrVersion;

/**
 * Classic V1: lower snake_case tags, recognized by the {@code "library"} distribution tag.
 */
public class ClassicV1Parser extends AbstractClassicParser {

    @Override
    public IrVersion version() {
        return IrVersion.CLASSIC_V1;
    }

    @Override
    public boolean accepts(JsonNode root) {
        return distributionTag(root).filter("library"::equals).isPresent();
    }
}
