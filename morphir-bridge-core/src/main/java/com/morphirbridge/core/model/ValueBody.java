package com.morphirbridge.core.model;

import java.util.Objects;

/**
 * Body of a value definition. Only {@link Expression} exists in the classic formats.
 */
public sealed interface ValueBody
    permits ValueBody.Expression, ValueBody.Native, ValueBody.External, ValueBody.Incomplete {

    record Expression(ValueExpr body) implements ValueBody {
        public Expression {
            Objects.requireNonNull(body, "body must not be null");
        }
    }

    record Native(NativeHint hint, String description) implements ValueBody {
        public Native {
            Objects.requireNonNull(hint, "hint must not be null");
        }
    }

    record External(String externalName, String targetPlatform) implements ValueBody {
        public External {
            Objects.requireNonNull(externalName, "externalName must not be null");
            Objects.requireNonNull(targetPlatform, "targetPlatform must not be null");
        }
    }

    record Incomplete(HoleReason reason) implements ValueBody {
        public Incomplete {
            Objects.requireNonNull(reason, "reason must not be null");
        }
    }
}
