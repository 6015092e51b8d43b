package com.notropolis.economy.store;

/**
 * Allocates opaque unique identifiers for new rows.
 */
@FunctionalInterface
public interface IdGenerator {
    String nextId();
}
