package com.notropolis.economy.recompute;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.notropolis.economy.catalog.BuildingCatalog;
import com.notropolis.economy.error.GameException;
import com.notropolis.economy.error.InternalException;
import com.notropolis.economy.error.NotFoundException;
import com.notropolis.economy.grid.GridIndex;
import com.notropolis.economy.model.BuildingInstance;
import com.notropolis.economy.model.BuildingType;
import com.notropolis.economy.model.GridCoord;
import com.notropolis.economy.model.Tile;
import com.notropolis.economy.profit.AdjacencyProfitCalculator;
import com.notropolis.economy.profit.ProfitResult;
import com.notropolis.economy.recompute.MapLeaseRegistry.Lease;
import com.notropolis.economy.store.GameStore;
import com.notropolis.economy.store.RowMutation;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Refreshes the cached profit of every dirty standing building on a map in one
 * pass and commits the results as a single batch.
 * <p>
 * At most one pass per map runs at a time. Each commit clears a building's
 * dirty flag only if nobody marked it again after the pass read it, so a mark
 * that lands mid-pass is picked up by the next pass.
 */
@RequiredArgsConstructor
public class RecomputeEngine {

    private static final Logger log = LoggerFactory.getLogger(RecomputeEngine.class);

    @NonNull
    private final GameStore store;
    @NonNull
    private final BuildingCatalog buildings;
    @NonNull
    private final AdjacencyProfitCalculator calculator;
    @NonNull
    private final MapLeaseRegistry leases;
    @NonNull
    private final Duration budget;
    @NonNull
    private final Clock clock;

    /**
     * @return number of buildings recomputed; 0 when nothing was dirty
     * @throws com.notropolis.economy.error.ConflictException if another pass holds the map past the lease timeout
     * @throws InternalException on budget overrun, interruption or a failed commit; nothing is persisted then
     */
    public int recompute(String mapId) {
        store.loadMap(mapId).orElseThrow(() -> new NotFoundException("Map", mapId));

        try (Lease lease = leases.acquire(mapId)) {
            return runPass(mapId);
        }
    }

    private int runPass(String mapId) {
        Instant started = clock.instant();
        Instant deadline = started.plus(budget);

        List<BuildingInstance> dirty = new ArrayList<>();
        for (BuildingInstance b : store.loadBuildings(mapId, true)) {
            if (!b.isCollapsed()) {
                dirty.add(b);
            }
        }
        if (dirty.isEmpty()) {
            log.debug("Map {}: nothing to recompute", mapId);
            return 0;
        }

        List<Tile> tiles = store.loadTiles(mapId);
        GridIndex grid = GridIndex.build(tiles, store.loadBuildings(mapId, false));

        List<RowMutation> commits = new ArrayList<>(dirty.size());
        for (BuildingInstance building : dirty) {
            checkBudget(mapId, deadline, dirty.size());

            BuildingType type = buildings.find(building.getBuildingTypeId())
                    .orElseThrow(() -> new InternalException("Building " + building.getId()
                            + " references unknown type " + building.getBuildingTypeId()));
            GridCoord coord = grid.coordOf(building)
                    .orElseThrow(() -> new InternalException("Building " + building.getId()
                            + " is not on a tile of map " + mapId));

            ProfitResult result = calculator.calculate(type, coord, grid);
            commits.add(new RowMutation.CommitProfit(building.getId(), result.getProfit(), result.getBreakdown(),
                    building.getProfitCache().getDirtyVersion()));
        }
        checkBudget(mapId, deadline, dirty.size());

        try {
            store.batchWrite(commits);
        } catch (GameException e) {
            log.error("Map {}: commit of {} recomputed buildings failed", mapId, commits.size(), e);
            throw e;
        } catch (RuntimeException e) {
            log.error("Map {}: commit of {} recomputed buildings failed", mapId, commits.size(), e);
            throw new InternalException("Failed to commit recompute pass for map " + mapId, e);
        }

        log.info("Map {}: recomputed {} buildings in {} ms", mapId, commits.size(),
                Duration.between(started, clock.instant()).toMillis());
        return commits.size();
    }

    private void checkBudget(String mapId, Instant deadline, int dirtyCount) {
        if (Thread.currentThread().isInterrupted()) {
            throw new InternalException("Recompute pass on map " + mapId + " was interrupted; nothing committed");
        }
        if (clock.instant().isAfter(deadline)) {
            // The whole dirty set stays pending, so a map that never fits the budget is retried every tick.
            log.warn("Map {}: recompute pass exceeded its budget of {} ms with {} dirty buildings pending",
                    mapId, budget.toMillis(), dirtyCount);
            throw new InternalException("Recompute pass on map " + mapId + " exceeded its time budget with "
                    + dirtyCount + " dirty buildings; nothing committed");
        }
    }
}
