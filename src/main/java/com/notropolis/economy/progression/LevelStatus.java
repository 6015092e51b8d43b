package com.notropolis.economy.progression;

import lombok.Builder;
import lombok.Value;

/**
 * Read-only progress report of a company toward its next tier.
 * At the top tier {@code nextLevel}, the next thresholds and {@code nextTierUnlocks}
 * are null and both progress figures are 100.
 */
@Value
@Builder
public class LevelStatus {
    String companyId;
    int level;
    Integer nextLevel;

    long cash;
    long totalActions;

    double cashProgressPercent;
    double actionsProgressPercent;

    Long nextCashThreshold;
    Long nextActionThreshold;

    TierUnlocks nextTierUnlocks;

    public boolean isMaxLevel() {
        return nextLevel == null;
    }
}
