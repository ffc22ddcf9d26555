package com.morphirbridge.core.model;

import com.morphirbridge.core.naming.Name;
import com.morphirbridge.core.util.OrderedMaps;

import java.util.Map;

/**
 * Public interface of a module in a dependency package.
 *
 * @param doc module documentation, {@code null} when absent
 */
public record ModuleSpecification(
    Map<Name, Documented<TypeSpecification>> types,
    Map<Name, Documented<ValueSpecification>> values,
    String doc
) {

    public ModuleSpecification {
        types = OrderedMaps.copyOf(types);
        values = OrderedMaps.copyOf(values);
    }
}
