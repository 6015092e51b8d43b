package com.notropolis.economy.config;

import java.time.Duration;

import lombok.Builder;
import lombok.Value;

/**
 * Tunables of the economy core.
 *
 * The adjacency radius bounds the neighborhood (24 cells at radius 2). The
 * diminishing-returns bonus curve is only calibrated for that window size.
 */
@Value
@Builder(toBuilder = true)
public class EngineConfig {

    @Builder.Default
    int adjacencyRadius = 2;

    /**
     * Wall-clock budget of one recompute pass. An over-budget pass commits nothing.
     */
    @Builder.Default
    Duration recomputeBudget = Duration.ofSeconds(30);

    /**
     * How long a recompute waits for the map lease held by another pass.
     */
    @Builder.Default
    Duration leaseWaitTimeout = Duration.ofSeconds(5);

    /**
     * Companies idle for this many ticks stop earning income.
     */
    @Builder.Default
    int idleTickLimit = 6;

    @Builder.Default
    double demolitionCostFraction = 0.10;

    @Builder.Default
    double minListingFraction = 0.80;

    @Builder.Default
    long baseLandPrice = 500L;

    /**
     * Damage percent to lost-health factor; at 85% damage a building earns nothing.
     */
    @Builder.Default
    double damageHealthFactor = 1.176;

    @Builder.Default
    String buildingTypesResource = "catalog/building-types.json";

    @Builder.Default
    String levelTiersResource = "catalog/level-tiers.json";

    public static EngineConfig defaults() {
        return EngineConfig.builder().build();
    }
}
