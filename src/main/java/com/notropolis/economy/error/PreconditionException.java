package com.notropolis.economy.error;

/**
 * A business rule rejected the action: insufficient funds, level too low,
 * license cap reached, imprisoned and so on.
 */
public class PreconditionException extends GameException {

    private static final long serialVersionUID = 1L;

    public enum Reason {
        IMPRISONED,
        NOT_IMPRISONED,
        INSUFFICIENT_FUNDS,
        LEVEL_TOO_LOW,
        LICENSE_CAP_REACHED,
        NOT_OWNER,
        NO_MAP,
        INVALID_STATE
    }

    private final Reason reason;

    public PreconditionException(Reason reason, String message) {
        super(ErrorKind.PRECONDITION, message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
