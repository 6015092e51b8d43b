package com.notropolis.economy.profit;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.notropolis.economy.grid.GridIndex;
import com.notropolis.economy.model.BuildingInstance;
import com.notropolis.economy.model.BuildingType;
import com.notropolis.economy.model.GridCoord;
import com.notropolis.economy.model.ProfitModifier;
import com.notropolis.economy.model.TerrainType;
import com.notropolis.economy.model.Tile;

/**
 * Computes a building's profit from the terrain and buildings around it.
 * <p>
 * Pure and deterministic: the same type, coordinate and index always give the
 * same profit and the same breakdown in the same order.
 * <ol>
 * <li>terrain bonus per terrain present: {@code rate * (1 + ln(n) / 2)}</li>
 * <li>terrain penalty per terrain present: {@code rate * n}</li>
 * <li>commercial synergy: {@code rate * 0.5 * buildings}, one line</li>
 * <li>commercial penalty: {@code rate * buildings}, one line</li>
 * <li>{@value #DAMAGED_NEIGHBOR_MODIFIER} for each neighbor more than half damaged</li>
 * </ol>
 * The result is {@code max(0, round(base * (1 + sum)))}.
 */
public class AdjacencyProfitCalculator {

    private static final Logger log = LoggerFactory.getLogger(AdjacencyProfitCalculator.class);

    public static final int DEFAULT_RADIUS = 2;

    static final double COMMERCIAL_SYNERGY_FACTOR = 0.5;
    static final double DAMAGED_NEIGHBOR_MODIFIER = -0.05;
    static final int DAMAGED_NEIGHBOR_THRESHOLD = 50;

    private final int radius;

    public AdjacencyProfitCalculator() {
        this(DEFAULT_RADIUS);
    }

    public AdjacencyProfitCalculator(int radius) {
        if (radius < 1) {
            throw new IllegalArgumentException("Adjacency radius must be >= 1. Got: " + radius);
        }
        this.radius = radius;
    }

    public ProfitResult calculate(BuildingType type, GridCoord coord, GridIndex grid) {
        List<Tile> neighborTiles = grid.neighborTiles(coord, radius);
        List<BuildingInstance> neighborBuildings = grid.neighborBuildings(coord, radius);

        Map<TerrainType, Integer> terrainCounts = new EnumMap<>(TerrainType.class);
        for (Tile tile : neighborTiles) {
            if (tile.getTerrain() != null) {
                terrainCounts.merge(tile.getTerrain(), 1, Integer::sum);
            }
        }

        ProfitResult.ProfitResultBuilder result = ProfitResult.builder();
        double total = 0.0;

        for (Map.Entry<TerrainType, Integer> entry : terrainCounts.entrySet()) {
            TerrainType terrain = entry.getKey();
            int n = entry.getValue();
            String label = "Adjacent " + terrain.getCatalogKey() + " (" + n + ")";

            Double bonusRate = type.getTerrainBonuses().get(terrain);
            if (bonusRate != null && bonusRate != 0.0) {
                double bonus = bonusRate * (1 + Math.log(n) / 2);
                total += bonus;
                result.line(ProfitModifier.of(label, bonus));
            }
            Double penaltyRate = type.getTerrainPenalties().get(terrain);
            if (penaltyRate != null && penaltyRate != 0.0) {
                double penalty = penaltyRate * n;
                total += penalty;
                result.line(ProfitModifier.of(label, penalty));
            }
        }

        int buildingCount = neighborBuildings.size();
        if (buildingCount > 0) {
            String label = "Adjacent buildings (" + buildingCount + ")";
            if (type.hasCommercialBonus()) {
                double bonus = type.getCommercialBonus() * COMMERCIAL_SYNERGY_FACTOR * buildingCount;
                total += bonus;
                result.line(ProfitModifier.of(label, bonus));
            }
            if (type.hasCommercialPenalty()) {
                double penalty = type.getCommercialPenalty() * buildingCount;
                total += penalty;
                result.line(ProfitModifier.of(label, penalty));
            }
        }

        for (BuildingInstance neighbor : neighborBuildings) {
            if (neighbor.getDamagePercent() > DAMAGED_NEIGHBOR_THRESHOLD) {
                total += DAMAGED_NEIGHBOR_MODIFIER;
                result.line(ProfitModifier.of("Damaged building (" + neighbor.getDamagePercent() + "%)",
                        DAMAGED_NEIGHBOR_MODIFIER));
            }
        }

        long profit = Math.max(0L, Math.round(type.getBaseProfit() * (1 + total)));
        log.debug("Profit of {} at {}: base={} modifier={} -> {}", type.getId(), coord, type.getBaseProfit(), total, profit);
        return result.profit(profit).totalModifier(total).build();
    }

    public int getRadius() {
        return radius;
    }
}
