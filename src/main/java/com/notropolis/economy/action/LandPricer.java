package com.notropolis.economy.action;

import com.notropolis.economy.error.ValidationException;
import com.notropolis.economy.model.GameMap;
import com.notropolis.economy.model.Tile;

/**
 * Price of an unowned tile: base price scaled by terrain and by the map's location tier.
 */
public class LandPricer {

    private final long basePrice;

    public LandPricer(long basePrice) {
        this.basePrice = basePrice;
    }

    public long price(Tile tile, GameMap map) {
        if (!tile.isOwnable()) {
            throw new ValidationException("Tile " + tile.getCoord() + " (" + describe(tile) + ") cannot be purchased");
        }
        double multiplier = tile.getTerrain().getLandPriceMultiplier() * map.getLocationTier().getCostMultiplier();
        return Math.round(basePrice * multiplier);
    }

    private static String describe(Tile tile) {
        if (tile.getSpecialStructure() != null) {
            return tile.getSpecialStructure().name().toLowerCase();
        }
        return tile.getTerrain() == null ? "no terrain" : tile.getTerrain().getCatalogKey();
    }
}
