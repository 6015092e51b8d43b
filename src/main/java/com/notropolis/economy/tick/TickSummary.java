package com.notropolis.economy.tick;

import java.time.Duration;
import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Totals of one tick across all active maps.
 */
@Value
@Builder
public class TickSummary {
    int mapsProcessed;
    int mapsFailed;
    int followUpsCompleted;

    @Singular
    List<MapTickResult> mapResults;

    Duration elapsed;

    public int getBuildingsRecalculated() {
        return mapResults.stream().mapToInt(MapTickResult::getBuildingsRecalculated).sum();
    }

    public int getCompaniesUpdated() {
        return mapResults.stream().mapToInt(MapTickResult::getCompaniesUpdated).sum();
    }

    public long getGrossProfit() {
        return mapResults.stream().mapToLong(MapTickResult::getGrossProfit).sum();
    }

    public long getTaxAmount() {
        return mapResults.stream().mapToLong(MapTickResult::getTaxAmount).sum();
    }

    public long getNetProfit() {
        return mapResults.stream().mapToLong(MapTickResult::getNetProfit).sum();
    }

    public int getLevelUps() {
        return mapResults.stream().mapToInt(MapTickResult::getLevelUps).sum();
    }
}
