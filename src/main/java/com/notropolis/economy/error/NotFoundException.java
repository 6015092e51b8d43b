package com.notropolis.economy.error;

public class NotFoundException extends GameException {

    private static final long serialVersionUID = 1L;

    public NotFoundException(String entity, String id) {
        super(ErrorKind.NOT_FOUND, entity + " not found: " + id);
    }

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}
