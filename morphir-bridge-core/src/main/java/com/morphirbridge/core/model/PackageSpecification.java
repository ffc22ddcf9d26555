package com.morphirbridge.core.model;

import com.morphirbridge.core.naming.Path;
import com.morphirbridge.core.util.OrderedMaps;

import java.util.Map;

/**
 * Public interface of a dependency package, keyed by module path.
 */
public record PackageSpecification(Map<Path, ModuleSpecification> modules) {

    public PackageSpecification {
        modules = OrderedMaps.copyOf(modules);
    }
}
