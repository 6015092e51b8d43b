package com.notropolis.economy.model;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Cached profit of a building together with its invalidation state.
 * <p>
 * Only a recompute writes {@code profit} and {@code breakdown}. Everything else
 * may only flip {@code dirty}. Each flip bumps {@code dirtyVersion} so that a
 * commit computed from an older snapshot never clears a newer mark.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ProfitCache {

    long profit;

    @Singular("modifier")
    List<ProfitModifier> breakdown;

    boolean dirty;

    long dirtyVersion;

    public static ProfitCache computed(long profit, List<ProfitModifier> breakdown) {
        return ProfitCache.builder().profit(profit).breakdown(breakdown).build();
    }

    public ProfitCache markDirty() {
        return toBuilder().dirty(true).dirtyVersion(dirtyVersion + 1).build();
    }

    /**
     * Stores a freshly computed value. The dirty flag is cleared only when no mark
     * happened after the snapshot at {@code snapshotVersion} was read.
     */
    public ProfitCache commit(long newProfit, List<ProfitModifier> newBreakdown, long snapshotVersion) {
        boolean stillCurrent = dirtyVersion == snapshotVersion;
        return toBuilder()
                .profit(newProfit)
                .clearBreakdown()
                .breakdown(newBreakdown)
                .dirty(dirty && !stillCurrent)
                .build();
    }
}
