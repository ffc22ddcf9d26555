package com.morphirbridge.core.model;

import com.morphirbridge.core.naming.FQName;
import com.morphirbridge.core.naming.Name;
import com.morphirbridge.core.util.OrderedMaps;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Value expressions. {@link Hole} exists only in V4.
 */
public sealed interface ValueExpr
    permits ValueExpr.LiteralValue, ValueExpr.Constructor, ValueExpr.Tuple, ValueExpr.ListOf,
            ValueExpr.Record, ValueExpr.Variable, ValueExpr.Reference, ValueExpr.Field,
            ValueExpr.FieldFunction, ValueExpr.Apply, ValueExpr.Lambda, ValueExpr.LetDefinition,
            ValueExpr.LetRecursion, ValueExpr.Destructure, ValueExpr.IfThenElse,
            ValueExpr.PatternMatch, ValueExpr.UpdateRecord, ValueExpr.Unit, ValueExpr.Hole {

    record LiteralValue(Literal literal) implements ValueExpr {
        public LiteralValue {
            Objects.requireNonNull(literal, "literal must not be null");
        }
    }

    record Constructor(FQName fqName) implements ValueExpr {
        public Constructor {
            Objects.requireNonNull(fqName, "fqName must not be null");
        }
    }

    record Tuple(List<ValueExpr> elements) implements ValueExpr {
        public Tuple {
            elements = elements == null ? List.of() : List.copyOf(elements);
        }
    }

    record ListOf(List<ValueExpr> items) implements ValueExpr {
        public ListOf {
            items = items == null ? List.of() : List.copyOf(items);
        }
    }

    record Record(Map<Name, ValueExpr> fields) implements ValueExpr {
        public Record {
            fields = OrderedMaps.copyOf(fields);
        }
    }

    record Variable(Name name) implements ValueExpr {
        public Variable {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    record Reference(FQName fqName) implements ValueExpr {
        public Reference {
            Objects.requireNonNull(fqName, "fqName must not be null");
        }
    }

    record Field(ValueExpr subject, Name name) implements ValueExpr {
        public Field {
            Objects.requireNonNull(subject, "subject must not be null");
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    record FieldFunction(Name name) implements ValueExpr {
        public FieldFunction {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    record Apply(ValueExpr function, ValueExpr argument) implements ValueExpr {
        public Apply {
            Objects.requireNonNull(function, "function must not be null");
            Objects.requireNonNull(argument, "argument must not be null");
        }
    }

    record Lambda(Pattern pattern, ValueExpr body) implements ValueExpr {
        public Lambda {
            Objects.requireNonNull(pattern, "pattern must not be null");
            Objects.requireNonNull(body, "body must not be null");
        }
    }

    record LetDefinition(Name name, ValueDefinition definition, ValueExpr in) implements ValueExpr {
        public LetDefinition {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(definition, "definition must not be null");
            Objects.requireNonNull(in, "in must not be null");
        }
    }

    record LetRecursion(Map<Name, ValueDefinition> bindings, ValueExpr in) implements ValueExpr {
        public LetRecursion {
            bindings = OrderedMaps.copyOf(bindings);
            Objects.requireNonNull(in, "in must not be null");
        }
    }

    record Destructure(Pattern pattern, ValueExpr value, ValueExpr in) implements ValueExpr {
        public Destructure {
            Objects.requireNonNull(pattern, "pattern must not be null");
            Objects.requireNonNull(value, "value must not be null");
            Objects.requireNonNull(in, "in must not be null");
        }
    }

    record IfThenElse(ValueExpr condition, ValueExpr thenBranch, ValueExpr elseBranch) implements ValueExpr {
        public IfThenElse {
            Objects.requireNonNull(condition, "condition must not be null");
            Objects.requireNonNull(thenBranch, "thenBranch must not be null");
            Objects.requireNonNull(elseBranch, "elseBranch must not be null");
        }
    }

    record PatternMatch(ValueExpr subject, List<Case> cases) implements ValueExpr {
        public PatternMatch {
            Objects.requireNonNull(subject, "subject must not be null");
            cases = cases == null ? List.of() : List.copyOf(cases);
        }
    }

    record Case(Pattern pattern, ValueExpr body) {
        public Case {
            Objects.requireNonNull(pattern, "pattern must not be null");
            Objects.requireNonNull(body, "body must not be null");
        }
    }

    record UpdateRecord(ValueExpr target, Map<Name, ValueExpr> updates) implements ValueExpr {
        public UpdateRecord {
            Objects.requireNonNull(target, "target must not be null");
            updates = OrderedMaps.copyOf(updates);
        }
    }

    record Unit() implements ValueExpr {
    }

    /**
     * @param type expected type, {@code null} when unknown
     */
    record Hole(HoleReason reason, TypeExpr type) implements ValueExpr {
        public Hole {
            Objects.requireNonNull(reason, "reason must not be null");
        }
    }
}
