package com.morphirbridge.core.error;

/**
 * An I/O failure other than a missing path, such as a permission problem or a full disk.
 */
public class IrIoException extends IrException {

    private final String path;

    public IrIoException(String path, Throwable cause) {
        super(ErrorKind.IO_ERROR, "I/O error on '" + path + "': " + cause.getMessage(), cause);
        this.path = path;
    }

    public IrIoException(String path, String reason) {
        this(path, "I/O error on '" + path + "': " + reason, null);
    }

    private IrIoException(String path, String message, Throwable cause) {
        super(ErrorKind.IO_ERROR, message, cause);
        this.path = path;
    }

    public String path() {
        return path;
    }

    @Override
    public IrIoException withContext(String context) {
        return new IrIoException(path, prefixed(context, getMessage()), this);
    }
}
