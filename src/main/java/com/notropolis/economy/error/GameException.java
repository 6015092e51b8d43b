package com.notropolis.economy.error;

/**
 * Base type for every typed failure returned by a game operation.
 * An operation either returns its result or throws exactly one of these.
 */
public abstract class GameException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;

    protected GameException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected GameException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
