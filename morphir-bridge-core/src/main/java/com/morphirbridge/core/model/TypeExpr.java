package com.morphirbridge.core.model;

import com.morphirbridge.core.naming.FQName;
import com.morphirbridge.core.naming.Name;
import com.morphirbridge.core.util.OrderedMaps;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Type expressions.
 *
 * <p>Classic attribute slots and V4 {@code attrs} are not part of the canonical model; the
 * parsers report them as cosmetic losses instead.
 */
public sealed interface TypeExpr
    permits TypeExpr.Variable, TypeExpr.Reference, TypeExpr.Tuple, TypeExpr.Record,
            TypeExpr.ExtensibleRecord, TypeExpr.Function, TypeExpr.Unit {

    record Variable(Name name) implements TypeExpr {
        public Variable {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    record Reference(FQName fqName, List<TypeExpr> args) implements TypeExpr {
        public Reference {
            Objects.requireNonNull(fqName, "fqName must not be null");
            args = args == null ? List.of() : List.copyOf(args);
        }

        public static Reference to(FQName fqName) {
            return new Reference(fqName, List.of());
        }
    }

    record Tuple(List<TypeExpr> elements) implements TypeExpr {
        public Tuple {
            elements = elements == null ? List.of() : List.copyOf(elements);
        }
    }

    record Record(Map<Name, TypeExpr> fields) implements TypeExpr {
        public Record {
            fields = OrderedMaps.copyOf(fields);
        }
    }

    record ExtensibleRecord(Name variable, Map<Name, TypeExpr> fields) implements TypeExpr {
        public ExtensibleRecord {
            Objects.requireNonNull(variable, "variable must not be null");
            fields = OrderedMaps.copyOf(fields);
        }
    }

    record Function(TypeExpr argument, TypeExpr result) implements TypeExpr {
        public Function {
            Objects.requireNonNull(argument, "argument must not be null");
            Objects.requireNonNull(result, "result must not be null");
        }
    }

    record Unit() implements TypeExpr {
    }
}
