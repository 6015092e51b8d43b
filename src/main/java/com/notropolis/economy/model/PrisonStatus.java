package com.notropolis.economy.model;

public enum PrisonStatus {
    FREE,
    IMPRISONED
}
