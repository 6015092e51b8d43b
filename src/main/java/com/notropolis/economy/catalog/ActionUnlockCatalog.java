package com.notropolis.economy.catalog;

import java.util.List;
import java.util.Map;

/**
 * Action types (attack kinds) that become available at each level.
 */
public final class ActionUnlockCatalog {

    private final Map<Integer, List<String>> byLevel;

    public ActionUnlockCatalog(Map<Integer, List<String>> byLevel) {
        this.byLevel = Map.copyOf(byLevel);
    }

    public List<String> unlockedAt(int level) {
        return byLevel.getOrDefault(level, List.of());
    }
}
