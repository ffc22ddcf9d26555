package com.morphirbridge.core.migration;

import com.fasterxml.jackson.databind.JsonNode;
import com.morphirbridge.core.format.CosmeticLoss;
import com.morphirbridge.core.format.IrVersion;
import com.morphirbridge.core.model.Distribution;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Output of one migration.
 *
 * @param target         version the document was encoded in
 * @param distribution   the migrated canonical distribution, package aliases already rewritten
 * @param document       the encoded single-file document
 * @param cosmeticLosses information dropped between the source bytes and {@code document}
 */
public record MigrationResult(IrVersion target, Distribution distribution, JsonNode document,
                              Set<CosmeticLoss> cosmeticLosses) {

    public MigrationResult {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(distribution, "distribution must not be null");
        Objects.requireNonNull(document, "document must not be null");
        cosmeticLosses = cosmeticLosses == null || cosmeticLosses.isEmpty()
            ? Set.of()
            : Set.copyOf(EnumSet.copyOf(cosmeticLosses));
    }
}
