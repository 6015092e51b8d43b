package com.notropolis.economy.error;

/**
 * Failure categories surfaced to callers of the economy core.
 */
public enum ErrorKind {
    VALIDATION,
    CONFLICT,
    PRECONDITION,
    NOT_FOUND,
    INTERNAL
}
