package com.notropolis.economy.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of terrain categories a tile can carry.
 * The catalog key is the name used in catalog and snapshot files.
 */
public enum TerrainType {
    OPEN_LAND("free_land", true, 1.0),
    WATER("water", false, 0.0),
    ROAD("road", false, 0.0),
    DIRT_TRACK("dirt_track", true, 0.8),
    WOODED("trees", true, 1.2);

    private final String catalogKey;
    private final boolean ownable;
    private final double landPriceMultiplier;

    TerrainType(String catalogKey, boolean ownable, double landPriceMultiplier) {
        this.catalogKey = catalogKey;
        this.ownable = ownable;
        this.landPriceMultiplier = landPriceMultiplier;
    }

    public String getCatalogKey() {
        return catalogKey;
    }

    /**
     * Water and road tiles can never carry an owner.
     */
    public boolean isOwnable() {
        return ownable;
    }

    public double getLandPriceMultiplier() {
        return landPriceMultiplier;
    }

    public static Optional<TerrainType> fromCatalogKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(t -> t.catalogKey.equals(normalized) || t.name().equalsIgnoreCase(normalized))
                .findFirst();
    }
}
