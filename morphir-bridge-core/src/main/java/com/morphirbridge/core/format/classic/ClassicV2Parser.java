package com.morphirbridge.core.format.classic;

import com.fasterxml.jackson.databind.JsonNode;
import com.morphirbridge.core.format.IrVersion;

import java.util.Optional;

/**
 * Classic V2: PascalCase tags, definitions without documentation wrappers.
 *
 * <p>A package that defines nothing carries no wrapper evidence either way; it is V2 only when
 * it declares {@code formatVersion: 2}.
 */
public class ClassicV2Parser extends AbstractClassicParser {

    @Override
    public IrVersion version() {
        return IrVersion.CLASSIC_V2;
    }

    @Override
    public boolean accepts(JsonNode root) {
        if (distributionTag(root).filter("Library"::equals).isEmpty()) {
            return false;
        }
        Optional<Boolean> documented = firstDefinitionDocumented(root);
        if (documented.isPresent()) {
            return !documented.get();
        }
        return declaredFormatVersion(root).filter(v -> v == 2).isPresent();
    }
}
