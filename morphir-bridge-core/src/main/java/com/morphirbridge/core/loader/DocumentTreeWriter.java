package com.morphirbridge.core.loader;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.morphirbridge.core.error.IrException;
import com.morphirbridge.core.format.IrJson;
import com.morphirbridge.core.format.v4.V4Writer;
import com.morphirbridge.core.model.Access;
import com.morphirbridge.core.model.AccessControlled;
import com.morphirbridge.core.model.Distribution;
import com.morphirbridge.core.model.ModuleDefinition;
import com.morphirbridge.core.naming.NameCanonicalizer;
import com.morphirbridge.core.naming.Path;
import com.morphirbridge.core.vfs.Vfs;
import com.morphirbridge.core.vfs.VfsPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Writes a distribution as a V4 Document Tree, one file per type and value.
 *
 * <p>Output is the inverse of {@link DocumentTreeLoader}: loading what this writer produced
 * yields an equal distribution. Writing into an existing tree first removes its {@code pkg/}
 * directory and {@code dependencies.json}, so modules of an earlier write do not survive.
 */
public class DocumentTreeWriter {

    private static final Logger log = LoggerFactory.getLogger(DocumentTreeWriter.class);

    private final V4Writer writer = new V4Writer();

    /**
     * @return number of files written
     */
    public int write(Distribution distribution, Vfs vfs, String root) {
        String normalizedRoot = VfsPaths.normalize(root);
        try {
            return writeTree(distribution, vfs, normalizedRoot);
        } catch (IrException e) {
            throw e.withContext("writing document tree '" + root + "'");
        }
    }

    private int writeTree(Distribution distribution, Vfs vfs, String root) {
        int stale = vfs.delete(VfsPaths.join(root, DocumentTreeLayout.PACKAGE_DIR))
            + vfs.delete(VfsPaths.join(root, DocumentTreeLayout.DEPENDENCIES_FILE));
        if (stale > 0) {
            log.debug("Removed {} files of an earlier tree under '{}'", stale, root);
        }
        int files = 0;

        ArrayNode moduleOrder = IrJson.array();
        distribution.modules().keySet().forEach(path -> moduleOrder.add(NameCanonicalizer.render(path)));
        ObjectNode descriptor = IrJson.object();
        descriptor.put("formatVersion", V4Writer.FORMAT_VERSION);
        descriptor.put("distribution", "Library");
        descriptor.put("packageName", NameCanonicalizer.render(distribution.packageName()));
        descriptor.put("layout", DocumentTreeLayout.LAYOUT);
        descriptor.set("modules", moduleOrder);
        files += writeJson(vfs, VfsPaths.join(root, DocumentTreeLayout.FORMAT_FILE), descriptor);

        if (!distribution.dependencies().isEmpty()) {
            files += writeJson(vfs, VfsPaths.join(root, DocumentTreeLayout.DEPENDENCIES_FILE),
                writer.dependencies(distribution.dependencies()));
        }

        for (Map.Entry<Path, AccessControlled<ModuleDefinition>> module : distribution.modules().entrySet()) {
            files += writeModule(vfs, root, distribution.packageName(), module.getKey(), module.getValue());
        }
        log.info("Wrote document tree '{}': {} modules, {} files", root, distribution.modules().size(), files);
        return files;
    }

    private int writeModule(Vfs vfs, String root, Path packageName, Path modulePath,
                            AccessControlled<ModuleDefinition> module) {
        String moduleDir = DocumentTreeLayout.moduleDir(root, packageName, modulePath);
        ModuleDefinition definition = module.value();
        int files = 0;

        ArrayNode typeNames = IrJson.array();
        for (var type : definition.types().entrySet()) {
            typeNames.add(NameCanonicalizer.render(type.getKey()));
            files += writeJson(vfs, DocumentTreeLayout.typeFile(moduleDir, type.getKey()), writer.typeEntry(type.getValue()));
        }
        ArrayNode valueNames = IrJson.array();
        for (var value : definition.values().entrySet()) {
            valueNames.add(NameCanonicalizer.render(value.getKey()));
            files += writeJson(vfs, DocumentTreeLayout.valueFile(moduleDir, value.getKey()), writer.valueEntry(value.getValue()));
        }

        ObjectNode manifest = IrJson.object();
        manifest.put("module", NameCanonicalizer.render(modulePath));
        manifest.put("access", module.access() == Access.PUBLIC ? "Public" : "Private");
        if (definition.doc() != null) {
            manifest.put("doc", definition.doc());
        }
        manifest.set("types", typeNames);
        manifest.set("values", valueNames);
        files += writeJson(vfs, VfsPaths.join(moduleDir, DocumentTreeLayout.MODULE_FILE), manifest);
        return files;
    }

    private static int writeJson(Vfs vfs, String path, JsonNode node) {
        vfs.write(path, IrJson.toPrettyBytes(node));
        return 1;
    }
}
