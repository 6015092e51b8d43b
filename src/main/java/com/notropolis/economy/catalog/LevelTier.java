package com.notropolis.economy.catalog;

import lombok.Value;

/**
 * One progression tier. Both thresholds must be met to hold the tier.
 */
@Value
public class LevelTier {
    int level;
    long cashThreshold;
    long actionThreshold;

    public boolean isSatisfiedBy(long cash, long totalActions) {
        return cash >= cashThreshold && totalActions >= actionThreshold;
    }
}
