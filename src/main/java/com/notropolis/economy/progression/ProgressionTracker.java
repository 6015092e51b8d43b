package com.notropolis.economy.progression;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.notropolis.economy.catalog.GameCatalog;
import com.notropolis.economy.catalog.LevelCatalog;
import com.notropolis.economy.catalog.LevelTier;
import com.notropolis.economy.error.NotFoundException;
import com.notropolis.economy.model.ActionKind;
import com.notropolis.economy.model.BuildingType;
import com.notropolis.economy.model.Company;
import com.notropolis.economy.model.TransactionLogEntry;
import com.notropolis.economy.store.GameStore;
import com.notropolis.economy.store.IdGenerator;
import com.notropolis.economy.store.RowMutation;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Derives company levels from cash and action totals and records level-ups.
 * <p>
 * The tier table is ascending with strictly increasing thresholds, so the scan
 * stops at the first tier that is not fully met. A stored level is never lowered.
 */
@RequiredArgsConstructor
public class ProgressionTracker {

    private static final Logger log = LoggerFactory.getLogger(ProgressionTracker.class);

    @NonNull
    private final GameStore store;
    @NonNull
    private final GameCatalog catalog;
    @NonNull
    private final IdGenerator ids;
    @NonNull
    private final Clock clock;

    /**
     * Highest tier whose cash and action thresholds are both met, from totals alone.
     */
    public int deriveTier(long cash, long totalActions) {
        LevelCatalog levels = catalog.getLevels();
        int level = levels.getMinLevel();
        for (LevelTier tier : levels.getTiers()) {
            if (!tier.isSatisfiedBy(cash, totalActions)) {
                break;
            }
            level = tier.getLevel();
        }
        return level;
    }

    /**
     * The level the company should hold now; never below its stored level.
     */
    public int recomputeLevel(Company company) {
        return Math.max(company.getLevel(), deriveTier(company.getCash(), company.getTotalActions()));
    }

    /**
     * Persists a level-up if the company's totals now reach a higher tier.
     * The level change and its log entry are written in one batch.
     */
    public Optional<LevelUp> checkLevelUp(String companyId) {
        Company company = store.loadCompany(companyId)
                .orElseThrow(() -> new NotFoundException("Company", companyId));

        int stored = company.getLevel();
        int derived = recomputeLevel(company);
        if (derived <= stored) {
            return Optional.empty();
        }

        TierUnlocks unlocks = unlocksAt(derived);
        TransactionLogEntry entry = TransactionLogEntry.builder()
                .id(ids.nextId())
                .companyId(companyId)
                .mapId(company.getCurrentMapId())
                .kind(ActionKind.LEVEL_UP)
                .amount(derived)
                .detail("fromLevel", stored)
                .detail("toLevel", derived)
                .detail("unlockedBuildings", unlocks.getBuildingTypeIds())
                .detail("unlockedActions", unlocks.getActionTypes())
                .createdAt(clock.instant())
                .build();

        store.batchWrite(List.of(
                new RowMutation.RaiseLevel(companyId, derived),
                new RowMutation.AppendLog(entry)));

        log.info("Company {} reached level {} (was {}), unlocked buildings={} actions={}",
                companyId, derived, stored, unlocks.getBuildingTypeIds(), unlocks.getActionTypes());
        return Optional.of(LevelUp.builder()
                .companyId(companyId)
                .previousLevel(stored)
                .newLevel(derived)
                .unlocks(unlocks)
                .build());
    }

    /**
     * Building types and action types that become available exactly at {@code level}.
     */
    public TierUnlocks unlocksAt(int level) {
        List<String> buildingIds = catalog.getBuildings().unlockedAt(level).stream()
                .map(BuildingType::getId)
                .collect(Collectors.toList());
        return TierUnlocks.builder()
                .level(level)
                .buildingTypeIds(buildingIds)
                .actionTypes(catalog.getActionUnlocks().unlockedAt(level))
                .build();
    }

    /**
     * Progress toward the next tier, measured from the current tier's thresholds.
     */
    public LevelStatus getLevelStatus(String companyId) {
        Company company = store.loadCompany(companyId)
                .orElseThrow(() -> new NotFoundException("Company", companyId));
        LevelCatalog levels = catalog.getLevels();
        int level = company.getLevel();

        LevelStatus.LevelStatusBuilder status = LevelStatus.builder()
                .companyId(companyId)
                .level(level)
                .cash(company.getCash())
                .totalActions(company.getTotalActions());

        Optional<LevelTier> next = levels.next(level);
        if (next.isEmpty()) {
            return status.cashProgressPercent(100.0).actionsProgressPercent(100.0).build();
        }

        LevelTier target = next.get();
        LevelTier current = levels.tier(level).orElse(levels.getTiers().get(0));
        return status
                .nextLevel(target.getLevel())
                .nextCashThreshold(target.getCashThreshold())
                .nextActionThreshold(target.getActionThreshold())
                .cashProgressPercent(progress(company.getCash(), current.getCashThreshold(), target.getCashThreshold()))
                .actionsProgressPercent(progress(company.getTotalActions(), current.getActionThreshold(),
                        target.getActionThreshold()))
                .nextTierUnlocks(unlocksAt(target.getLevel()))
                .build();
    }

    static double progress(long value, long from, long to) {
        if (to <= from) {
            return 100.0;
        }
        double pct = (value - from) * 100.0 / (to - from);
        return Math.max(0.0, Math.min(100.0, pct));
    }
}
