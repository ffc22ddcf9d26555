package com.morphirbridge.core.model;

import com.morphirbridge.core.naming.Name;

import java.util.Objects;

/**
 * A named, typed slot: a value input, a specification input or a constructor argument.
 *
 * @param name parameter name
 * @param type declared type; {@code null} only in an incomplete value definition
 */
public record Parameter(Name name, TypeExpr type) {

    public Parameter {
        Objects.requireNonNull(name, "name must not be null");
    }
}
