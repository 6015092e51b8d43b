package com.notropolis.economy.model;

/**
 * Administrator-placed structures. A tile carrying one is never ownable.
 */
public enum SpecialStructure {
    TEMPLE,
    BANK,
    POLICE_STATION
}
