package com.notropolis.economy.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class GameMap {

    @NonNull
    String id;

    String name;

    int width;

    int height;

    @NonNull
    LocationTier locationTier;

    /**
     * Day of week (0-6) on which enforcement is suspended. Null when unset.
     */
    Integer enforcementDay;

    @Builder.Default
    boolean active = true;

    public boolean contains(int x, int y) {
        return x >= 0 && y >= 0 && x < width && y < height;
    }
}
