package com.morphirbridge.core.model;

import com.morphirbridge.core.naming.Name;

import java.util.List;
import java.util.Objects;

/**
 * Public shape of a type as seen by dependents of a package.
 */
public sealed interface TypeSpecification
    permits TypeSpecification.TypeAliasSpecification, TypeSpecification.OpaqueTypeSpecification,
            TypeSpecification.CustomTypeSpecification {

    List<Name> typeParams();

    record TypeAliasSpecification(List<Name> typeParams, TypeExpr body) implements TypeSpecification {
        public TypeAliasSpecification {
            typeParams = typeParams == null ? List.of() : List.copyOf(typeParams);
            Objects.requireNonNull(body, "body must not be null");
        }
    }

    record OpaqueTypeSpecification(List<Name> typeParams) implements TypeSpecification {
        public OpaqueTypeSpecification {
            typeParams = typeParams == null ? List.of() : List.copyOf(typeParams);
        }
    }

    record CustomTypeSpecification(List<Name> typeParams, List<Constructor> constructors)
        implements TypeSpecification {
        public CustomTypeSpecification {
            typeParams = typeParams == null ? List.of() : List.copyOf(typeParams);
            constructors = constructors == null ? List.of() : List.copyOf(constructors);
        }
    }
}
