package com.notropolis.economy.catalog;

import lombok.NonNull;
import lombok.Value;

/**
 * Reference data loaded once at start-up.
 */
@Value
public class GameCatalog {

    @NonNull
    BuildingCatalog buildings;

    @NonNull
    LevelCatalog levels;

    @NonNull
    ActionUnlockCatalog actionUnlocks;
}
