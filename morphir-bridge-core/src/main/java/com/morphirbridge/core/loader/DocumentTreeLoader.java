package com.morphirbridge.core.loader;

import com.fasterxml.jackson.databind.JsonNode;
import com.morphirbridge.core.error.IrException;
import com.morphirbridge.core.error.IrParseException;
import com.morphirbridge.core.error.UnrecognizedFormatException;
import com.morphirbridge.core.format.CosmeticLoss;
import com.morphirbridge.core.format.IrJson;
import com.morphirbridge.core.format.IrVersion;
import com.morphirbridge.core.format.ParsedDistribution;
import com.morphirbridge.core.format.v4.V4Parser;
import com.morphirbridge.core.format.v4.V4Reader;
import com.morphirbridge.core.format.v4.V4Writer;
import com.morphirbridge.core.model.Access;
import com.morphirbridge.core.model.AccessControlled;
import com.morphirbridge.core.model.Distribution;
import com.morphirbridge.core.model.Documented;
import com.morphirbridge.core.model.ModuleDefinition;
import com.morphirbridge.core.model.PackageSpecification;
import com.morphirbridge.core.model.TypeDefinition;
import com.morphirbridge.core.model.ValueDefinition;
import com.morphirbridge.core.naming.Name;
import com.morphirbridge.core.naming.NameCanonicalizer;
import com.morphirbridge.core.naming.Path;
import com.morphirbridge.core.vfs.Vfs;
import com.morphirbridge.core.vfs.VfsPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Assembles a V4 Document Tree into one canonical distribution.
 *
 * <p>The root {@code format.json} names the package and, optionally, lists its modules in
 * declaration order; module manifests are found by globbing {@code pkg/<package>/**&#47;module.json}
 * and read in that order, the unlisted ones last in path order. Each manifest
 * lists the type and value fragments of its module in declaration order. Every failure names the
 * file it came from.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ParsedDistribution parsed = new DocumentTreeLoader().load(new OsVfs(Paths.get(".")), "out");
 * }</pre>
 */
public class DocumentTreeLoader {

    private static final Logger log = LoggerFactory.getLogger(DocumentTreeLoader.class);

    /**
     * @param vfs  file system holding the tree
     * @param root directory of the tree inside the VFS, {@code ""} for the VFS root
     * @throws com.morphirbridge.core.error.IrNotFoundException if {@code format.json} or a listed fragment is missing
     * @throws UnrecognizedFormatException if {@code format.json} does not describe a V4 tree
     * @throws IrParseException if any file is malformed
     */
    public ParsedDistribution load(Vfs vfs, String root) {
        try {
            return loadTree(vfs, VfsPaths.normalize(root));
        } catch (IrException e) {
            throw e.withContext("loading document tree '" + root + "'");
        }
    }

    private ParsedDistribution loadTree(Vfs vfs, String root) {
        String formatPath = VfsPaths.join(root, DocumentTreeLayout.FORMAT_FILE);
        JsonNode descriptor = IrJson.read(vfs.read(formatPath), formatPath);

        Set<CosmeticLoss> losses = EnumSet.noneOf(CosmeticLoss.class);
        JsonNode formatVersion = descriptor.path("formatVersion");
        if (!V4Parser.isV4Label(formatVersion)) {
            throw new UnrecognizedFormatException("'" + formatPath + "' declares formatVersion " + formatVersion
                + ", expected a V4 document tree");
        }
        if (!formatVersion.isMissingNode() && !V4Writer.FORMAT_VERSION.equals(formatVersion.asText())) {
            losses.add(CosmeticLoss.FORMAT_VERSION_LABEL);
        }
        JsonNode layout = descriptor.path("layout");
        if (!layout.isMissingNode() && !DocumentTreeLayout.LAYOUT.equals(layout.asText())) {
            losses.add(CosmeticLoss.LAYOUT_HINT);
        }
        String kind = descriptor.path("distribution").asText("Library");
        if (!kind.equals("Library")) {
            throw new IrParseException("/distribution", "unsupported distribution kind '" + kind + "'").inFile(formatPath);
        }

        V4Reader reader = new V4Reader();
        Path packageName = inFile(formatPath, () -> reader.packagePath(descriptor.get("packageName"), "/packageName"));

        Map<Path, PackageSpecification> dependencies = Map.of();
        String dependenciesPath = VfsPaths.join(root, DocumentTreeLayout.DEPENDENCIES_FILE);
        if (vfs.exists(dependenciesPath)) {
            JsonNode dependenciesNode = IrJson.read(vfs.read(dependenciesPath), dependenciesPath);
            dependencies = inFile(dependenciesPath, () -> reader.readDependencies(dependenciesNode, ""));
        }

        String packageDir = DocumentTreeLayout.packageDir(root, packageName);
        List<String> manifests;
        try (Stream<String> found = vfs.glob(packageDir + "/**/" + DocumentTreeLayout.MODULE_FILE)) {
            manifests = found.sorted().collect(Collectors.toList());
        }
        if (descriptor.has("modules")) {
            manifests = listedManifests(descriptor.get("modules"), manifests, root, packageName, formatPath, reader);
        }
        log.debug("Found {} module manifests under {}", manifests.size(), packageDir);

        Map<Path, AccessControlled<ModuleDefinition>> modules = new LinkedHashMap<>();
        for (String manifestPath : manifests) {
            ModuleEntry module = loadModule(vfs, root, packageName, manifestPath, reader);
            if (modules.containsKey(module.path())) {
                throw new IrParseException("/module", "duplicate module '" + module.path() + "'").inFile(manifestPath);
            }
            modules.put(module.path(), module.definition());
        }

        losses.addAll(reader.losses());
        Distribution distribution = new Distribution(packageName, dependencies, modules);
        log.info("Loaded document tree '{}': package {}, {} modules", root, packageName, modules.size());
        return new ParsedDistribution(IrVersion.V4, distribution, losses);
    }

    /**
     * Orders the manifests by the {@code modules} list of {@code format.json}. Manifests the list
     * leaves out follow in path order; a listed module without a manifest fails when it is read.
     */
    private static List<String> listedManifests(JsonNode listed, List<String> found, String root, Path packageName,
                                                String formatPath, V4Reader reader) {
        if (!listed.isArray()) {
            throw new IrParseException("/modules", "expected an array of module paths").inFile(formatPath);
        }
        Set<String> ordered = new LinkedHashSet<>();
        for (int i = 0; i < listed.size(); i++) {
            String at = "/modules/" + i;
            JsonNode element = listed.get(i);
            if (!element.isTextual()) {
                throw new IrParseException(at, "expected a module path").inFile(formatPath);
            }
            Path modulePath = inFile(formatPath, () -> reader.path(element.asText(), at));
            String manifest = VfsPaths.join(DocumentTreeLayout.moduleDir(root, packageName, modulePath),
                DocumentTreeLayout.MODULE_FILE);
            if (!ordered.add(manifest)) {
                throw new IrParseException(at, "duplicate module '" + modulePath + "'").inFile(formatPath);
            }
        }
        ordered.addAll(found);
        return new ArrayList<>(ordered);
    }

    private record ModuleEntry(Path path, AccessControlled<ModuleDefinition> definition) {
    }

    private ModuleEntry loadModule(Vfs vfs, String root, Path packageName, String manifestPath, V4Reader reader) {
        JsonNode manifest = IrJson.read(vfs.read(manifestPath), manifestPath);
        if (!manifest.isObject() || !manifest.path("module").isTextual()) {
            throw new IrParseException("/module", "module manifest needs a 'module' path").inFile(manifestPath);
        }
        Path modulePath = inFile(manifestPath, () -> reader.path(manifest.get("module").asText(), "/module"));
        String moduleDir = DocumentTreeLayout.moduleDir(root, packageName, modulePath);
        if (!moduleDir.equals(VfsPaths.parent(manifestPath))) {
            throw new IrParseException("/module", "module '" + modulePath + "' is stored in the wrong directory")
                .inFile(manifestPath);
        }
        Access access = Access.PUBLIC;
        if (manifest.has("access")) {
            access = inFile(manifestPath, () -> reader.readAccess(manifest.get("access"), "/access"));
        }

        List<Name> typeNames = names(manifest, "types", manifestPath, reader);
        List<Name> valueNames = names(manifest, "values", manifestPath, reader);
        checkNoUnlistedFragments(vfs, moduleDir, DocumentTreeLayout.TYPES_DIR, DocumentTreeLayout.TYPE_SUFFIX,
            typeNames, manifestPath);
        checkNoUnlistedFragments(vfs, moduleDir, DocumentTreeLayout.VALUES_DIR, DocumentTreeLayout.VALUE_SUFFIX,
            valueNames, manifestPath);

        Map<Name, AccessControlled<Documented<TypeDefinition>>> types = new LinkedHashMap<>();
        for (Name name : typeNames) {
            String fragment = DocumentTreeLayout.typeFile(moduleDir, name);
            JsonNode node = readFragment(vfs, fragment, manifestPath);
            types.put(name, inFile(fragment, () -> reader.readTypeEntry(node, "")));
        }
        Map<Name, AccessControlled<Documented<ValueDefinition>>> values = new LinkedHashMap<>();
        for (Name name : valueNames) {
            String fragment = DocumentTreeLayout.valueFile(moduleDir, name);
            JsonNode node = readFragment(vfs, fragment, manifestPath);
            values.put(name, inFile(fragment, () -> reader.readValueEntry(node, "")));
        }

        String doc = manifest.path("doc").isTextual() ? manifest.get("doc").asText() : null;
        log.debug("Loaded module {} with {} types and {} values", modulePath, types.size(), values.size());
        return new ModuleEntry(modulePath, new AccessControlled<>(access, new ModuleDefinition(types, values, doc)));
    }

    private static JsonNode readFragment(Vfs vfs, String fragment, String manifestPath) {
        try {
            return IrJson.read(vfs.read(fragment), fragment);
        } catch (IrException e) {
            throw e.withContext("fragment listed in '" + manifestPath + "'");
        }
    }

    private static List<Name> names(JsonNode manifest, String section, String manifestPath, V4Reader reader) {
        JsonNode node = manifest.path(section);
        List<Name> names = new ArrayList<>();
        if (node.isMissingNode()) {
            return names;
        }
        if (!node.isArray()) {
            throw new IrParseException("/" + section, "expected an array of names").inFile(manifestPath);
        }
        Set<Name> seen = new HashSet<>();
        for (int i = 0; i < node.size(); i++) {
            String at = "/" + section + "/" + i;
            JsonNode element = node.get(i);
            Name name = inFile(manifestPath, () -> reader.name(element, at));
            if (!seen.add(name)) {
                throw new IrParseException(at, "duplicate name '" + name + "'").inFile(manifestPath);
            }
            names.add(name);
        }
        return names;
    }

    private static void checkNoUnlistedFragments(Vfs vfs, String moduleDir, String dir, String suffix,
                                                 List<Name> listed, String manifestPath) {
        Set<String> expected = new HashSet<>();
        for (Name name : listed) {
            expected.add(VfsPaths.join(moduleDir, dir + "/" + NameCanonicalizer.render(name) + suffix));
        }
        try (Stream<String> fragments = vfs.glob(moduleDir + "/" + dir + "/*" + suffix)) {
            fragments.filter(path -> !expected.contains(path)).findFirst().ifPresent(path -> {
                throw new IrParseException("", "fragment is not listed in '" + manifestPath + "'").inFile(path);
            });
        }
    }

    @FunctionalInterface
    private interface Read<T> {
        T get();
    }

    private static <T> T inFile(String path, Read<T> read) {
        try {
            return read.get();
        } catch (IrParseException e) {
            throw e.inFile(path);
        }
    }
}
