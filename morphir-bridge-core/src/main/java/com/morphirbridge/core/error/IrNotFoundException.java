package com.morphirbridge.core.error;

/**
 * A path that was asked for does not exist.
 */
public class IrNotFoundException extends IrException {

    private final String path;

    public IrNotFoundException(String path) {
        this(path, "not found: '" + path + "'", null);
    }

    private IrNotFoundException(String path, String message, Throwable cause) {
        super(ErrorKind.NOT_FOUND, message, cause);
        this.path = path;
    }

    public String path() {
        return path;
    }

    @Override
    public IrNotFoundException withContext(String context) {
        return new IrNotFoundException(path, prefixed(context, getMessage()), this);
    }
}
