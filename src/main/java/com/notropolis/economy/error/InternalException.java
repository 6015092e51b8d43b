package com.notropolis.economy.error;

/**
 * Storage or batch-commit failure. Nothing from the failed batch was persisted.
 */
public class InternalException extends GameException {

    private static final long serialVersionUID = 1L;

    public InternalException(String message) {
        super(ErrorKind.INTERNAL, message);
    }

    public InternalException(String message, Throwable cause) {
        super(ErrorKind.INTERNAL, message, cause);
    }
}
