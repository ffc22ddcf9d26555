package com.morphirbridge.core;

import com.morphirbridge.core.format.IrJson;
import com.morphirbridge.core.format.IrVersion;
import com.morphirbridge.core.format.ParsedDistribution;
import com.morphirbridge.core.loader.DistributionLoader;
import com.morphirbridge.core.loader.DocumentTreeWriter;
import com.morphirbridge.core.migration.IrMigrator;
import com.morphirbridge.core.migration.MigrationResult;
import com.morphirbridge.core.model.Distribution;
import com.morphirbridge.core.vfs.Vfs;
import com.morphirbridge.core.vfs.VfsPaths;
import com.morphirbridge.core.visitor.IrVisitor;
import com.morphirbridge.core.visitor.IrWalker;
import com.morphirbridge.core.visitor.Reducer;
import com.morphirbridge.core.visitor.TraversalResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The three entry points a front end needs: load, migrate and visit, plus writing a migration
 * result back to a {@link Vfs}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * MorphirBridge bridge = new MorphirBridge();
 * Vfs vfs = new OsVfs(Paths.get("."));
 *
 * ParsedDistribution parsed = bridge.load(vfs, "morphir-ir.json");
 * MigrationResult result = bridge.migrate(parsed, IrVersion.V4);
 * bridge.write(result, vfs, ".morphir-dist");
 * }</pre>
 */
public class MorphirBridge {

    private static final Logger log = LoggerFactory.getLogger(MorphirBridge.class);

    /** Output file name used when a classic target is written into a directory. */
    public static final String CLASSIC_OUTPUT_FILE = "morphir-ir.json";

    private final DistributionLoader loader;
    private final IrMigrator migrator;
    private final DocumentTreeWriter treeWriter;

    public MorphirBridge() {
        this(new DistributionLoader(), new IrMigrator(), new DocumentTreeWriter());
    }

    public MorphirBridge(DistributionLoader loader, IrMigrator migrator, DocumentTreeWriter treeWriter) {
        this.loader = loader;
        this.migrator = migrator;
        this.treeWriter = treeWriter;
    }

    /**
     * Loads a single IR file or a Document Tree directory.
     */
    public ParsedDistribution load(Vfs vfs, String path) {
        return loader.load(vfs, path);
    }

    public MigrationResult migrate(ParsedDistribution source, IrVersion target) {
        return migrator.migrate(source, target);
    }

    /**
     * Writes a migration result. A path ending in {@code .json} receives the single-file
     * document; any other path is a directory that receives a Document Tree for V4 or
     * {@value #CLASSIC_OUTPUT_FILE} for classic targets.
     *
     * @return number of files written
     */
    public int write(MigrationResult result, Vfs vfs, String path) {
        String normalized = VfsPaths.normalize(path);
        if (normalized.endsWith(".json")) {
            vfs.write(normalized, IrJson.toPrettyBytes(result.document()));
            log.info("Wrote {} document to {}", result.target(), normalized);
            return 1;
        }
        if (result.target() == IrVersion.V4) {
            int files = treeWriter.write(result.distribution(), vfs, normalized);
            log.info("Wrote document tree with {} files to {}", files, normalized);
            return files;
        }
        String file = VfsPaths.join(normalized, CLASSIC_OUTPUT_FILE);
        vfs.write(file, IrJson.toPrettyBytes(result.document()));
        log.info("Wrote {} document to {}", result.target(), file);
        return 1;
    }

    public <R> TraversalResult<R> visit(Distribution distribution, IrVisitor<R> visitor, Reducer<R> reducer) {
        return new IrWalker<>(visitor, reducer).walk(distribution);
    }
}
