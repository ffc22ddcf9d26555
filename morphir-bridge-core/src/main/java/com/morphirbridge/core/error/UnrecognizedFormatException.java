package com.morphirbridge.core.error;

/**
 * The input matched no known IR version shape, or matched more than one.
 */
public class UnrecognizedFormatException extends IrException {

    public UnrecognizedFormatException(String message) {
        super(ErrorKind.UNRECOGNIZED_FORMAT, message);
    }

    private UnrecognizedFormatException(String message, Throwable cause) {
        super(ErrorKind.UNRECOGNIZED_FORMAT, message, cause);
    }

    @Override
    public UnrecognizedFormatException withContext(String context) {
        return new UnrecognizedFormatException(prefixed(context, getMessage()), this);
    }
}
