package com.morphirbridge.core.model;

import com.morphirbridge.core.naming.Name;
import com.morphirbridge.core.util.OrderedMaps;

import java.util.Map;

/**
 * Types and values defined in one module, in declaration order.
 *
 * @param doc module documentation, {@code null} when absent
 */
public record ModuleDefinition(
    Map<Name, AccessControlled<Documented<TypeDefinition>>> types,
    Map<Name, AccessControlled<Documented<ValueDefinition>>> values,
    String doc
) {

    public ModuleDefinition {
        types = OrderedMaps.copyOf(types);
        values = OrderedMaps.copyOf(values);
    }

    public static ModuleDefinition empty() {
        return new ModuleDefinition(Map.of(), Map.of(), null);
    }
}
