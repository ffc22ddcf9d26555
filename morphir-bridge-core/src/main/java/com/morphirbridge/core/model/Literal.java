package com.morphirbridge.core.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Literal constants usable in values and patterns.
 */
public sealed interface Literal
    permits Literal.BoolLiteral, Literal.CharLiteral, Literal.StringLiteral,
            Literal.WholeNumberLiteral, Literal.FloatLiteral, Literal.DecimalLiteral {

    record BoolLiteral(boolean value) implements Literal {
    }

    /**
     * @param value a single character, kept as a string so supplementary code points survive
     */
    record CharLiteral(String value) implements Literal {
        public CharLiteral {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    record StringLiteral(String value) implements Literal {
        public StringLiteral {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    record WholeNumberLiteral(long value) implements Literal {
    }

    record FloatLiteral(double value) implements Literal {
    }

    record DecimalLiteral(BigDecimal value) implements Literal {
        public DecimalLiteral {
            Objects.requireNonNull(value, "value must not be null");
        }
    }
}
