package com.notropolis.economy.tick;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.notropolis.economy.action.ActionFollowUps;
import com.notropolis.economy.action.FollowUpQueue;
import com.notropolis.economy.config.EngineConfig;
import com.notropolis.economy.error.NotFoundException;
import com.notropolis.economy.model.ActionKind;
import com.notropolis.economy.model.BuildingInstance;
import com.notropolis.economy.model.Company;
import com.notropolis.economy.model.GameMap;
import com.notropolis.economy.model.TransactionLogEntry;
import com.notropolis.economy.progression.LevelUp;
import com.notropolis.economy.recompute.RecomputeEngine;
import com.notropolis.economy.store.GameStore;
import com.notropolis.economy.store.IdGenerator;
import com.notropolis.economy.store.RowMutation;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Periodic economy tick. Passive: nothing here goes through the prison gate.
 * <p>
 * Per map: refresh dirty profits, then pay every recently active owner the
 * health-weighted profit of its standing buildings less the location tax.
 * Owners idle for the configured number of ticks earn nothing. A failure on
 * one map is logged and the remaining maps still run.
 */
@RequiredArgsConstructor
public class TickProcessor {

    private static final Logger log = LoggerFactory.getLogger(TickProcessor.class);

    @NonNull
    private final GameStore store;
    @NonNull
    private final RecomputeEngine recomputeEngine;
    @NonNull
    private final FollowUpQueue followUpQueue;
    @NonNull
    private final ActionFollowUps followUps;
    @NonNull
    private final IdGenerator ids;
    @NonNull
    private final Clock clock;
    @NonNull
    private final EngineConfig config;

    public TickSummary processTick() {
        Instant started = clock.instant();
        int followUpsCompleted = followUpQueue.drain();

        TickSummary.TickSummaryBuilder summary = TickSummary.builder().followUpsCompleted(followUpsCompleted);
        int processed = 0;
        int failed = 0;
        for (GameMap map : store.loadMaps()) {
            if (!map.isActive()) {
                continue;
            }
            try {
                summary.mapResult(processMap(map.getId()));
                processed++;
            } catch (RuntimeException e) {
                failed++;
                log.error("Tick failed for map {}", map.getId(), e);
            }
        }

        TickSummary result = summary
                .mapsProcessed(processed)
                .mapsFailed(failed)
                .elapsed(Duration.between(started, clock.instant()))
                .build();
        log.info("Tick complete: {} maps ({} failed), {} buildings recalculated, {} companies paid, net {}",
                processed, failed, result.getBuildingsRecalculated(), result.getCompaniesUpdated(),
                result.getNetProfit());
        return result;
    }

    public MapTickResult processMap(String mapId) {
        GameMap map = store.loadMap(mapId).orElseThrow(() -> new NotFoundException("Map", mapId));
        int recalculated = recomputeEngine.recompute(mapId);

        Map<String, List<BuildingInstance>> standingByOwner = new LinkedHashMap<>();
        for (BuildingInstance b : store.loadBuildings(mapId, false)) {
            if (!b.isCollapsed()) {
                standingByOwner.computeIfAbsent(b.getCompanyId(), k -> new ArrayList<>()).add(b);
            }
        }

        double taxRate = map.getLocationTier().getTaxRate();
        Instant now = clock.instant();
        List<RowMutation> batch = new ArrayList<>();
        Set<String> paid = new LinkedHashSet<>();
        long totalGross = 0;
        long totalTax = 0;
        long totalNet = 0;

        for (Map.Entry<String, List<BuildingInstance>> entry : standingByOwner.entrySet()) {
            String companyId = entry.getKey();
            Company company = store.loadCompany(companyId).orElse(null);
            if (company == null) {
                log.warn("Map {}: buildings owned by unknown company {} skipped", mapId, companyId);
                continue;
            }
            if (company.getTicksSinceAction() >= config.getIdleTickLimit()) {
                continue;
            }

            long gross = Math.round(healthWeightedProfit(entry.getValue()));
            long tax = Math.round(gross * taxRate);
            long net = gross - tax;

            batch.add(new RowMutation.AdjustCash(companyId, net, false));
            batch.add(new RowMutation.AdvanceIdleTicks(companyId));
            if (net != 0) {
                batch.add(new RowMutation.AppendLog(TransactionLogEntry.builder()
                        .id(ids.nextId())
                        .companyId(companyId)
                        .mapId(mapId)
                        .kind(ActionKind.TICK_INCOME)
                        .amount(net)
                        .detail("gross", gross)
                        .detail("tax", tax)
                        .detail("buildings", entry.getValue().size())
                        .createdAt(now)
                        .build()));
            }
            paid.add(companyId);
            totalGross += gross;
            totalTax += tax;
            totalNet += net;
        }

        int idle = 0;
        for (Company company : store.loadCompaniesOnMap(mapId)) {
            if (!standingByOwner.containsKey(company.getId())) {
                batch.add(new RowMutation.AdvanceIdleTicks(company.getId()));
                idle++;
            }
        }

        store.batchWrite(batch);
        List<LevelUp> levelUps = followUps.checkLevels(paid);

        log.info("Map {}: {} buildings recalculated, {} companies paid gross={} tax={} net={}", mapId, recalculated,
                paid.size(), totalGross, totalTax, totalNet);
        return MapTickResult.builder()
                .mapId(mapId)
                .buildingsRecalculated(recalculated)
                .companiesUpdated(paid.size())
                .idleCompaniesAdvanced(idle)
                .grossProfit(totalGross)
                .taxAmount(totalTax)
                .netProfit(totalNet)
                .levelUps(levelUps.size())
                .build();
    }

    /**
     * Sum of cached profits scaled by remaining health. Past roughly 85% damage
     * a building's contribution turns negative.
     */
    double healthWeightedProfit(List<BuildingInstance> buildings) {
        double total = 0.0;
        for (BuildingInstance b : buildings) {
            total += b.getCachedProfit() * (100 - b.getDamagePercent() * config.getDamageHealthFactor()) / 100;
        }
        return total;
    }
}
