package com.notropolis.economy.progression;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class LevelUp {
    String companyId;
    int previousLevel;
    int newLevel;
    TierUnlocks unlocks;
}
