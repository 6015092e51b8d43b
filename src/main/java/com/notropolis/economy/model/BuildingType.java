package com.notropolis.economy.model;

import java.util.Map;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Immutable catalog entry describing a constructible building.
 * Penalty rates are stored signed (negative) and applied as given.
 */
@Value
@Builder
public class BuildingType {

    @NonNull
    String id;

    String name;

    long cost;

    long baseProfit;

    @Builder.Default
    int levelRequired = 1;

    boolean requiresLicense;

    @Singular("terrainBonus")
    Map<TerrainType, Double> terrainBonuses;

    @Singular("terrainPenalty")
    Map<TerrainType, Double> terrainPenalties;

    /**
     * Synergy rate per neighboring building; zero when the type has none.
     */
    double commercialBonus;

    /**
     * Linear rate per neighboring building; zero when the type has none.
     */
    double commercialPenalty;

    Integer maxPerMap;

    public boolean hasCommercialBonus() {
        return commercialBonus != 0.0;
    }

    public boolean hasCommercialPenalty() {
        return commercialPenalty != 0.0;
    }

    public Optional<Integer> getMaxPerMapLimit() {
        return Optional.ofNullable(maxPerMap);
    }
}
