package com.notropolis.economy.action;

import java.util.List;

import com.notropolis.economy.model.ProfitModifier;
import com.notropolis.economy.progression.LevelUp;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Outcome of a construction, with the profit the building earns in its current neighborhood.
 */
@Value
@Builder
public class BuildResult {
    String buildingId;
    long cost;
    long remainingCash;
    long profit;
    List<ProfitModifier> breakdown;

    @Singular
    List<LevelUp> levelUps;
}
