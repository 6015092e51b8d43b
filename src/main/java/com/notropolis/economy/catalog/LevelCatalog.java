package com.notropolis.economy.catalog;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Ordered, ascending tier table. Thresholds strictly increase with the level so
 * a scan may stop at the first tier that is not satisfied.
 */
public final class LevelCatalog {

    private final List<LevelTier> tiers;

    public LevelCatalog(List<LevelTier> tiers) {
        if (tiers == null || tiers.isEmpty()) {
            throw new IllegalArgumentException("Level catalog must contain at least one tier");
        }
        List<LevelTier> sorted = new ArrayList<>(tiers);
        sorted.sort(Comparator.comparingInt(LevelTier::getLevel));
        for (int i = 1; i < sorted.size(); i++) {
            LevelTier prev = sorted.get(i - 1);
            LevelTier cur = sorted.get(i);
            if (cur.getLevel() != prev.getLevel() + 1) {
                throw new IllegalArgumentException("Level tiers must be consecutive, found " + prev.getLevel() + " then " + cur.getLevel());
            }
            if (cur.getCashThreshold() <= prev.getCashThreshold() || cur.getActionThreshold() <= prev.getActionThreshold()) {
                throw new IllegalArgumentException("Level " + cur.getLevel() + " thresholds must exceed those of level " + prev.getLevel());
            }
        }
        this.tiers = List.copyOf(sorted);
    }

    public List<LevelTier> getTiers() {
        return tiers;
    }

    public int getMinLevel() {
        return tiers.get(0).getLevel();
    }

    public int getMaxLevel() {
        return tiers.get(tiers.size() - 1).getLevel();
    }

    public Optional<LevelTier> tier(int level) {
        int index = level - getMinLevel();
        if (index < 0 || index >= tiers.size()) {
            return Optional.empty();
        }
        return Optional.of(tiers.get(index));
    }

    public Optional<LevelTier> next(int level) {
        return tier(level + 1);
    }
}
