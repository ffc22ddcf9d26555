package com.morphirbridge.core.model;

import com.morphirbridge.core.naming.FQName;
import com.morphirbridge.core.naming.Name;

import java.util.List;
import java.util.Objects;

/**
 * Patterns used by lambdas, destructuring and pattern matches.
 *
 * <p>An as-binding over a wildcard is a plain variable binding; build as-bindings through
 * {@link #as(Pattern, Name)} so that form is always represented as {@link VariablePattern}.
 */
public sealed interface Pattern
    permits Pattern.WildcardPattern, Pattern.VariablePattern, Pattern.AsPattern, Pattern.TuplePattern,
            Pattern.ConstructorPattern, Pattern.EmptyListPattern, Pattern.HeadTailPattern,
            Pattern.LiteralPattern, Pattern.UnitPattern {

    static Pattern as(Pattern pattern, Name name) {
        if (pattern instanceof WildcardPattern) {
            return new VariablePattern(name);
        }
        return new AsPattern(pattern, name);
    }

    record WildcardPattern() implements Pattern {
    }

    record VariablePattern(Name name) implements Pattern {
        public VariablePattern {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    record AsPattern(Pattern pattern, Name name) implements Pattern {
        public AsPattern {
            Objects.requireNonNull(pattern, "pattern must not be null");
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    record TuplePattern(List<Pattern> elements) implements Pattern {
        public TuplePattern {
            elements = elements == null ? List.of() : List.copyOf(elements);
        }
    }

    record ConstructorPattern(FQName constructor, List<Pattern> args) implements Pattern {
        public ConstructorPattern {
            Objects.requireNonNull(constructor, "constructor must not be null");
            args = args == null ? List.of() : List.copyOf(args);
        }
    }

    record EmptyListPattern() implements Pattern {
    }

    record HeadTailPattern(Pattern head, Pattern tail) implements Pattern {
        public HeadTailPattern {
            Objects.requireNonNull(head, "head must not be null");
            Objects.requireNonNull(tail, "tail must not be null");
        }
    }

    record LiteralPattern(Literal literal) implements Pattern {
        public LiteralPattern {
            Objects.requireNonNull(literal, "literal must not be null");
        }
    }

    record UnitPattern() implements Pattern {
    }
}
