package com.notropolis.economy.error;

/**
 * A concurrent mutation won the race. Callers may retry with fresh data.
 */
public class ConflictException extends GameException {

    private static final long serialVersionUID = 1L;

    public ConflictException(String message) {
        super(ErrorKind.CONFLICT, message);
    }
}
