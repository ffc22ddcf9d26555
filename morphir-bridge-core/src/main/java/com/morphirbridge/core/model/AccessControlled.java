package com.morphirbridge.core.model;

import java.util.Objects;

/**
 * A value paired with its visibility.
 */
public record AccessControlled<T>(Access access, T value) {

    public AccessControlled {
        Objects.requireNonNull(access, "access must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }

    public static <T> AccessControlled<T> publicly(T value) {
        return new AccessControlled<>(Access.PUBLIC, value);
    }

    public static <T> AccessControlled<T> privately(T value) {
        return new AccessControlled<>(Access.PRIVATE, value);
    }

    public <U> AccessControlled<U> withValue(U newValue) {
        return new AccessControlled<>(access, newValue);
    }
}
