package com.morphirbridge.core.error;

/**
 * Base class for all failures raised while loading, detecting, parsing, migrating or
 * writing Morphir IR.
 *
 * <p>Every failure carries an {@link ErrorKind} so callers can branch on the category
 * without catching individual subclasses. Components that call into other components add
 * their own context with {@link #withContext(String)}, which keeps the kind and chains the
 * original exception as the cause.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * try {
 *     parser.parse(root);
 * } catch (IrException e) {
 *     throw e.withContext("module '" + path + "'");
 * }
 * }</pre>
 */
public abstract class IrException extends RuntimeException {

    private final ErrorKind kind;

    protected IrException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected IrException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    /**
     * Returns a new exception of the same kind whose message is prefixed with {@code context}
     * and whose cause is this exception.
     *
     * @param context short description of what the caller was doing
     * @return wrapped exception, never {@code null}
     */
    public abstract IrException withContext(String context);

    protected static String prefixed(String context, String message) {
        return context + ": " + message;
    }
}
