package com.morphirbridge.core.error;

import com.morphirbridge.core.naming.FQName;

/**
 * A value definition is missing its body or a type annotation.
 */
public class IncompleteDefinitionException extends IrException {

    private final FQName definition;

    public IncompleteDefinitionException(FQName definition, String detail) {
        super(ErrorKind.INCOMPLETE_DEFINITION,
            "incomplete definition '" + definition.toCanonicalString() + "': " + detail);
        this.definition = definition;
    }

    private IncompleteDefinitionException(FQName definition, String message, Throwable cause) {
        super(ErrorKind.INCOMPLETE_DEFINITION, message, cause);
        this.definition = definition;
    }

    public FQName definition() {
        return definition;
    }

    @Override
    public IncompleteDefinitionException withContext(String context) {
        return new IncompleteDefinitionException(definition, prefixed(context, getMessage()), this);
    }
}
