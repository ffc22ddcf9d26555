package com.morphirbridge.core.error;

/**
 * A construct in the source distribution has no defined mapping into the target version,
 * or a reference in it does not resolve.
 */
public class MigrationUnsupportedException extends IrException {

    public MigrationUnsupportedException(String message) {
        super(ErrorKind.MIGRATION_UNSUPPORTED, message);
    }

    private MigrationUnsupportedException(String message, Throwable cause) {
        super(ErrorKind.MIGRATION_UNSUPPORTED, message, cause);
    }

    @Override
    public MigrationUnsupportedException withContext(String context) {
        return new MigrationUnsupportedException(prefixed(context, getMessage()), this);
    }
}
