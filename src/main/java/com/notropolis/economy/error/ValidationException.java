package com.notropolis.economy.error;

/**
 * Malformed or out-of-range input, e.g. non-purchasable terrain or an unknown building type.
 */
public class ValidationException extends GameException {

    private static final long serialVersionUID = 1L;

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }
}
