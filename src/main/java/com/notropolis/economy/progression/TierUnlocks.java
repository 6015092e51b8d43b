package com.notropolis.economy.progression;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Content that becomes available exactly at one tier. Not cumulative.
 */
@Value
@Builder
public class TierUnlocks {
    int level;

    @Singular
    List<String> buildingTypeIds;

    @Singular
    List<String> actionTypes;

    public boolean isEmpty() {
        return buildingTypeIds.isEmpty() && actionTypes.isEmpty();
    }
}
