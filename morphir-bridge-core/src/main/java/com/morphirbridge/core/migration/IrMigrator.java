package com.morphirbridge.core.migration;

import com.fasterxml.jackson.databind.JsonNode;
import com.morphirbridge.core.error.IrException;
import com.morphirbridge.core.error.MigrationUnsupportedException;
import com.morphirbridge.core.format.CosmeticLoss;
import com.morphirbridge.core.format.IrVersion;
import com.morphirbridge.core.format.IrWriter;
import com.morphirbridge.core.format.ParsedDistribution;
import com.morphirbridge.core.format.classic.ClassicWriter;
import com.morphirbridge.core.format.v4.V4Writer;
import com.morphirbridge.core.model.Distribution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Migrates a canonical distribution into the wire form of a target version.
 *
 * <p>A migration runs, in order:
 * <ol>
 *   <li>the completeness check ({@link CompletenessChecker})</li>
 *   <li>package alias rewriting for the target ({@link PackageAliasRewriter})</li>
 *   <li>type reference resolution ({@link ReferenceResolver})</li>
 *   <li>encoding with the target's {@link IrWriter}, which rejects constructs it cannot express</li>
 * </ol>
 * Any failure aborts the whole migration; there is no partial output. Name canonicalization is
 * not a separate step: names are segment lists in the model and each writer renders them in
 * its own casing.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * MigrationResult result = new IrMigrator().migrate(parsed, IrVersion.resolveTarget("latest"));
 * byte[] bytes = IrJson.toPrettyBytes(result.document());
 * }</pre>
 */
public class IrMigrator {

    private static final Logger log = LoggerFactory.getLogger(IrMigrator.class);

    private final Map<IrVersion, IrWriter> writers = new EnumMap<>(IrVersion.class);
    private final CompletenessChecker completenessChecker = new CompletenessChecker();
    private final ReferenceResolver referenceResolver = new ReferenceResolver();

    public IrMigrator() {
        this(List.of(new ClassicWriter(), new V4Writer()));
    }

    public IrMigrator(List<IrWriter> writers) {
        writers.forEach(writer -> this.writers.put(writer.version(), writer));
    }

    public MigrationResult migrate(ParsedDistribution source, IrVersion target) {
        log.info("Migrating {} from {} to {}", source.distribution().packageName(), source.version(), target);
        return migrate(source.distribution(), target, source.cosmeticLosses());
    }

    public MigrationResult migrate(Distribution distribution, IrVersion target) {
        log.info("Migrating {} to {}", distribution.packageName(), target);
        return migrate(distribution, target, Set.of());
    }

    private MigrationResult migrate(Distribution distribution, IrVersion target, Set<CosmeticLoss> losses) {
        IrWriter writer = writers.get(target);
        if (writer == null) {
            throw new MigrationUnsupportedException("no writer for target '" + target
                + "'; classic targets are written in the " + IrVersion.CLASSIC_V3 + " shape");
        }
        String context = "migrating '" + distribution.packageName().toCanonicalString() + "' to " + target;
        try {
            completenessChecker.check(distribution);
            Distribution migrated = PackageAliasRewriter.forTarget(target).rewrite(distribution);
            referenceResolver.resolve(migrated);
            JsonNode document = writer.write(migrated);
            losses.forEach(loss -> log.warn("Dropped {} during migration to {}", loss.description(), target));
            log.info("Migrated {} modules, {} types, {} values",
                migrated.modules().size(), migrated.typeCount(), migrated.valueCount());
            return new MigrationResult(target, migrated, document, losses);
        } catch (IrException e) {
            throw e.withContext(context);
        }
    }
}
