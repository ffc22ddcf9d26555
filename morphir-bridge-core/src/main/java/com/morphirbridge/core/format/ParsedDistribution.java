package com.morphirbridge.core.format;

import com.morphirbridge.core.model.Distribution;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Result of parsing one IR document: the detected version, the canonical distribution and
 * the cosmetic information that was dropped on the way in.
 */
public record ParsedDistribution(IrVersion version, Distribution distribution, Set<CosmeticLoss> cosmeticLosses) {

    public ParsedDistribution {
        Objects.requireNonNull(version, "version must not be null");
        Objects.requireNonNull(distribution, "distribution must not be null");
        cosmeticLosses = cosmeticLosses == null || cosmeticLosses.isEmpty()
            ? Set.of()
            : Set.copyOf(EnumSet.copyOf(cosmeticLosses));
    }

    public ParsedDistribution withLoss(CosmeticLoss loss) {
        Set<CosmeticLoss> losses = EnumSet.of(loss);
        losses.addAll(cosmeticLosses);
        return new ParsedDistribution(version, distribution, losses);
    }
}
