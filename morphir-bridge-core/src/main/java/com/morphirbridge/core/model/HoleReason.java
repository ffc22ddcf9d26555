package com.morphirbridge.core.model;

import com.morphirbridge.core.naming.FQName;

import java.util.Objects;

/**
 * Why a V4 hole, incomplete body or incomplete type definition exists.
 */
public sealed interface HoleReason
    permits HoleReason.UnresolvedReference, HoleReason.DeletedDuringRefactor,
            HoleReason.TypeMismatch, HoleReason.Draft {

    record UnresolvedReference(FQName target) implements HoleReason {
        public UnresolvedReference {
            Objects.requireNonNull(target, "target must not be null");
        }
    }

    record DeletedDuringRefactor() implements HoleReason {
    }

    record TypeMismatch() implements HoleReason {
    }

    record Draft() implements HoleReason {
    }
}
