package com.morphirbridge.core.model;

import com.morphirbridge.core.naming.Name;

import java.util.List;
import java.util.Objects;

/**
 * A constructor of a custom type with its named, typed arguments.
 */
public record Constructor(Name name, List<Parameter> args) {

    public Constructor {
        Objects.requireNonNull(name, "name must not be null");
        args = args == null ? List.of() : List.copyOf(args);
    }
}
