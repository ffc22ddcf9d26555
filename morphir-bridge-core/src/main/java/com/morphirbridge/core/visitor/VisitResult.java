package com.morphirbridge.core.visitor;

import java.util.Objects;

/**
 * What a visitor wants the walker to do with the node it was just shown, plus an optional
 * contribution to the traversal's reduced value.
 *
 * @param <N> node type
 * @param <R> contribution type
 */
public record VisitResult<N, R>(Action action, N replacement, R contribution) {

    public enum Action {
        /** Keep the node and walk its children. */
        PROCEED,
        /** Substitute the node, then walk the children of the substitute. */
        REPLACE,
        /** Keep the node and do not walk its children. */
        SKIP
    }

    public VisitResult {
        Objects.requireNonNull(action, "action must not be null");
        if (action == Action.REPLACE) {
            Objects.requireNonNull(replacement, "a replacement is required");
        }
    }

    public static <N, R> VisitResult<N, R> proceed() {
        return new VisitResult<>(Action.PROCEED, null, null);
    }

    public static <N, R> VisitResult<N, R> proceed(R contribution) {
        return new VisitResult<>(Action.PROCEED, null, contribution);
    }

    public static <N, R> VisitResult<N, R> replace(N replacement) {
        return new VisitResult<>(Action.REPLACE, replacement, null);
    }

    public static <N, R> VisitResult<N, R> replace(N replacement, R contribution) {
        return new VisitResult<>(Action.REPLACE, replacement, contribution);
    }

    public static <N, R> VisitResult<N, R> skip() {
        return new VisitResult<>(Action.SKIP, null, null);
    }

    public static <N, R> VisitResult<N, R> skip(R contribution) {
        return new VisitResult<>(Action.SKIP, null, contribution);
    }
}
