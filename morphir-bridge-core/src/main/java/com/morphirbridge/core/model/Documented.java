package com.morphirbridge.core.model;

import java.util.Objects;

/**
 * A value paired with its documentation string. Missing documentation is the empty string.
 */
public record Documented<T>(String doc, T value) {

    public Documented {
        doc = doc == null ? "" : doc;
        Objects.requireNonNull(value, "value must not be null");
    }

    public static <T> Documented<T> undocumented(T value) {
        return new Documented<>("", value);
    }

    public <U> Documented<U> withValue(U newValue) {
        return new Documented<>(doc, newValue);
    }
}
