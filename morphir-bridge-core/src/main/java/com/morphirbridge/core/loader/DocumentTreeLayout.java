package com.morphirbridge.core.loader;

import com.morphirbridge.core.naming.Name;
import com.morphirbridge.core.naming.NameCanonicalizer;
import com.morphirbridge.core.naming.Path;
import com.morphirbridge.core.vfs.VfsPaths;

/**
 * File names and directory layout of a V4 Document Tree.
 *
 * <pre>
 * &lt;root&gt;/format.json
 * &lt;root&gt;/dependencies.json
 * &lt;root&gt;/pkg/&lt;package&gt;/&lt;module&gt;/module.json
 * &lt;root&gt;/pkg/&lt;package&gt;/&lt;module&gt;/types/&lt;name&gt;.type.json
 * &lt;root&gt;/pkg/&lt;package&gt;/&lt;module&gt;/values/&lt;name&gt;.value.json
 * </pre>
 */
public final class DocumentTreeLayout {

    public static final String FORMAT_FILE = "format.json";
    public static final String DEPENDENCIES_FILE = "dependencies.json";
    public static final String MODULE_FILE = "module.json";
    public static final String PACKAGE_DIR = "pkg";
    public static final String TYPES_DIR = "types";
    public static final String VALUES_DIR = "values";
    public static final String TYPE_SUFFIX = ".type.json";
    public static final String VALUE_SUFFIX = ".value.json";
    public static final String LAYOUT = "VfsMode";

    private DocumentTreeLayout() {
        // Utility class
    }

    public static String packageDir(String root, Path packageName) {
        return VfsPaths.join(VfsPaths.join(root, PACKAGE_DIR), NameCanonicalizer.render(packageName));
    }

    public static String moduleDir(String root, Path packageName, Path modulePath) {
        return VfsPaths.join(packageDir(root, packageName), NameCanonicalizer.render(modulePath));
    }

    public static String typeFile(String moduleDir, Name name) {
        return VfsPaths.join(moduleDir, TYPES_DIR + "/" + NameCanonicalizer.render(name) + TYPE_SUFFIX);
    }

    public static String valueFile(String moduleDir, Name name) {
        return VfsPaths.join(moduleDir, VALUES_DIR + "/" + NameCanonicalizer.render(name) + VALUE_SUFFIX);
    }
}
