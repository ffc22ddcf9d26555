package com.morphirbridge.core.format.classic;

import com.fasterxml.jackson.databind.JsonNode;
import com.morphirbridge.core.format.IrVersion;

import java.util.Optional;

/**
 * Classic V3: PascalCase tags, every type and value definition wrapped in
 * {@code {"doc": ..., "value": ...}}.
 */
public class ClassicV3Parser extends AbstractClassicParser {

    @Override
    public IrVersion version() {
        return IrVersion.CLASSIC_V3;
    }

    @Override
    public boolean accepts(JsonNode root) {
        if (distributionTag(root).filter("Library"::equals).isEmpty()) {
            return false;
        }
        Optional<Boolean> documented = firstDefinitionDocumented(root);
        if (documented.isPresent()) {
            return documented.get();
        }
        return declaredFormatVersion(root).filter(v -> v == 2).isEmpty();
    }
}
