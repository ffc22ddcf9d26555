package com.morphirbridge.core.loader;

import com.fasterxml.jackson.databind.JsonNode;
import com.morphirbridge.core.error.IrException;
import com.morphirbridge.core.error.IrNotFoundException;
import com.morphirbridge.core.error.IrParseException;
import com.morphirbridge.core.format.FormatDetector;
import com.morphirbridge.core.format.IrJson;
import com.morphirbridge.core.format.ParsedDistribution;
import com.morphirbridge.core.vfs.Vfs;
import com.morphirbridge.core.vfs.VfsPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for reading IR from a {@link Vfs}: a single JSON file in any supported version,
 * or a V4 Document Tree directory.
 *
 * <p>A directory must contain {@code format.json}. A path to a {@code format.json} file is
 * treated as the tree it describes. Any other file is a single document whose version is
 * decided by the {@link FormatDetector}.
 */
public class DistributionLoader {

    private static final Logger log = LoggerFactory.getLogger(DistributionLoader.class);

    private final FormatDetector detector;
    private final DocumentTreeLoader treeLoader;

    public DistributionLoader() {
        this(new FormatDetector(), new DocumentTreeLoader());
    }

    public DistributionLoader(FormatDetector detector, DocumentTreeLoader treeLoader) {
        this.detector = detector;
        this.treeLoader = treeLoader;
    }

    public ParsedDistribution load(Vfs vfs, String path) {
        String normalized = VfsPaths.normalize(path);
        if (vfs.isDirectory(normalized)) {
            if (!vfs.exists(VfsPaths.join(normalized, DocumentTreeLayout.FORMAT_FILE))) {
                throw new IrNotFoundException(VfsPaths.join(normalized, DocumentTreeLayout.FORMAT_FILE))
                    .withContext("'" + normalized + "' is a directory but not a document tree");
            }
            return treeLoader.load(vfs, normalized);
        }
        if (VfsPaths.fileName(normalized).equals(DocumentTreeLayout.FORMAT_FILE)) {
            return treeLoader.load(vfs, VfsPaths.parent(normalized));
        }
        return loadFile(vfs, normalized);
    }

    private ParsedDistribution loadFile(Vfs vfs, String path) {
        JsonNode root = IrJson.read(vfs.read(path), path);
        try {
            ParsedDistribution parsed = detector.parse(root);
            log.info("Loaded {} distribution '{}' from {}", parsed.version(), parsed.distribution().packageName(), path);
            return parsed;
        } catch (IrParseException e) {
            throw e.inFile(path);
        } catch (IrException e) {
            throw e.withContext("'" + path + "'");
        }
    }
}
