package com.morphirbridge.core.model;

import java.util.List;

/**
 * Definition of a value: typed inputs, output type and body.
 *
 * <p>The output type and body are nullable so that an incomplete definition read from disk can
 * be reported by the migration engine with its fully-qualified name instead of failing deep
 * inside the parser.
 */
public record ValueDefinition(List<Parameter> inputs, TypeExpr outputType, ValueBody body) {

    public ValueDefinition {
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
    }

    public static ValueDefinition expression(List<Parameter> inputs, TypeExpr outputType, ValueExpr body) {
        return new ValueDefinition(inputs, outputType, new ValueBody.Expression(body));
    }
}
