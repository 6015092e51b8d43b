package com.notropolis.economy.model;

/**
 * Map location tier. Drives land prices, starting capital and income tax.
 */
public enum LocationTier {
    TOWN(1.0, 50_000L, 0.10),
    CITY(5.0, 1_000_000L, 0.15),
    CAPITAL(20.0, 5_000_000L, 0.20);

    private final double costMultiplier;
    private final long startingCash;
    private final double taxRate;

    LocationTier(double costMultiplier, long startingCash, double taxRate) {
        this.costMultiplier = costMultiplier;
        this.startingCash = startingCash;
        this.taxRate = taxRate;
    }

    public double getCostMultiplier() {
        return costMultiplier;
    }

    public long getStartingCash() {
        return startingCash;
    }

    public double getTaxRate() {
        return taxRate;
    }
}
