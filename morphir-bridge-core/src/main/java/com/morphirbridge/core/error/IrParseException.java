package com.morphirbridge.core.error;

/**
 * A document was recognized but is malformed.
 *
 * <p>Carries the JSON pointer of the offending node (relative to the document root) and,
 * once a loader has wrapped it, the source path of the document.
 */
public class IrParseException extends IrException {

    private final String pointer;
    private final String sourcePath;

    public IrParseException(String pointer, String message) {
        this(pointer, null, "at '" + pointer + "': " + message, null);
    }

    public IrParseException(String pointer, String message, Throwable cause) {
        this(pointer, null, "at '" + pointer + "': " + message, cause);
    }

    private IrParseException(String pointer, String sourcePath, String message, Throwable cause) {
        super(ErrorKind.PARSE_ERROR, message, cause);
        this.pointer = pointer;
        this.sourcePath = sourcePath;
    }

    public String pointer() {
        return pointer;
    }

    /**
     * @return the file the error was found in, or {@code null} when parsing an in-memory tree
     */
    public String sourcePath() {
        return sourcePath;
    }

    /**
     * Wraps this error with the file it was read from.
     */
    public IrParseException inFile(String path) {
        return new IrParseException(pointer, path, prefixed("'" + path + "'", getMessage()), this);
    }

    @Override
    public IrParseException withContext(String context) {
        return new IrParseException(pointer, sourcePath, prefixed(context, getMessage()), this);
    }
}
