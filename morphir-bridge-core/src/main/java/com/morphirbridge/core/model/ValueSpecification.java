package com.morphirbridge.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Public signature of a value.
 */
public record ValueSpecification(List<Parameter> inputs, TypeExpr output) {

    public ValueSpecification {
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        Objects.requireNonNull(output, "output must not be null");
    }
}
