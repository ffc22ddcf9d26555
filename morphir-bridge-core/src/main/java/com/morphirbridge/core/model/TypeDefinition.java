package com.morphirbridge.core.model;

import com.morphirbridge.core.naming.Name;

import java.util.List;
import java.util.Objects;

/**
 * Definition of a type inside a module: an alias, a custom (sum) type, or a V4 incomplete
 * placeholder.
 */
public sealed interface TypeDefinition
    permits TypeDefinition.TypeAlias, TypeDefinition.CustomType, TypeDefinition.Incomplete {

    List<Name> typeParams();

    record TypeAlias(List<Name> typeParams, TypeExpr body) implements TypeDefinition {
        public TypeAlias {
            typeParams = typeParams == null ? List.of() : List.copyOf(typeParams);
            Objects.requireNonNull(body, "body must not be null");
        }
    }

    record CustomType(List<Name> typeParams, AccessControlled<List<Constructor>> constructors)
        implements TypeDefinition {
        public CustomType {
            typeParams = typeParams == null ? List.of() : List.copyOf(typeParams);
            Objects.requireNonNull(constructors, "constructors must not be null");
            constructors = constructors.withValue(List.copyOf(constructors.value()));
        }
    }

    /**
     * Only representable in V4.
     */
    record Incomplete(List<Name> typeParams, Incompleteness incompleteness) implements TypeDefinition {
        public Incomplete {
            typeParams = typeParams == null ? List.of() : List.copyOf(typeParams);
            Objects.requireNonNull(incompleteness, "incompleteness must not be null");
        }
    }

    sealed interface Incompleteness permits Hole, Draft {
    }

    record Hole(HoleReason reason) implements Incompleteness {
        public Hole {
            Objects.requireNonNull(reason, "reason must not be null");
        }
    }

    record Draft() implements Incompleteness {
    }
}
