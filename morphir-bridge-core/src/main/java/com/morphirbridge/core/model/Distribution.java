package com.morphirbridge.core.model;

import com.morphirbridge.core.naming.Path;
import com.morphirbridge.core.util.OrderedMaps;

import java.util.Map;
import java.util.Objects;

/**
 * A compiled library package: its modules plus the specifications of the packages it depends on.
 *
 * <p>This is the canonical, version-independent form every parser produces and every writer
 * consumes. Structural equality ({@link #equals(Object)}) is the round-trip criterion.
 *
 * @param packageName  package path, e.g. {@code my-org/my-pkg}
 * @param dependencies dependency specifications keyed by package path
 * @param modules      module definitions keyed by module path, in declaration order
 */
public record Distribution(
    Path packageName,
    Map<Path, PackageSpecification> dependencies,
    Map<Path, AccessControlled<ModuleDefinition>> modules
) {

    public Distribution {
        Objects.requireNonNull(packageName, "packageName must not be null");
        dependencies = OrderedMaps.copyOf(dependencies);
        modules = OrderedMaps.copyOf(modules);
    }

    public int typeCount() {
        return modules.values().stream().mapToInt(m -> m.value().types().size()).sum();
    }

    public int valueCount() {
        return modules.values().stream().mapToInt(m -> m.value().values().size()).sum();
    }
}
