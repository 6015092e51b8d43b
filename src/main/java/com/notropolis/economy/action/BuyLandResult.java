package com.notropolis.economy.action;

import java.util.List;

import com.notropolis.economy.progression.LevelUp;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class BuyLandResult {
    String tileId;
    long cost;
    long remainingCash;

    @Singular
    List<LevelUp> levelUps;
}
