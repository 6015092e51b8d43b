package com.notropolis.economy;

import java.time.Clock;

import com.notropolis.economy.action.ActionFollowUps;
import com.notropolis.economy.action.ActionResult;
import com.notropolis.economy.action.BuildResult;
import com.notropolis.economy.action.BuildingConditionService;
import com.notropolis.economy.action.BuyLandResult;
import com.notropolis.economy.action.FollowUpQueue;
import com.notropolis.economy.action.GameActionService;
import com.notropolis.economy.action.LandPricer;
import com.notropolis.economy.action.PayFineResult;
import com.notropolis.economy.action.PrisonService;
import com.notropolis.economy.action.ProfitPreview;
import com.notropolis.economy.catalog.CatalogLoader;
import com.notropolis.economy.catalog.GameCatalog;
import com.notropolis.economy.config.EngineConfig;
import com.notropolis.economy.dirty.DirtyTracker;
import com.notropolis.economy.gate.ActionGate;
import com.notropolis.economy.model.BuildingInstance;
import com.notropolis.economy.profit.AdjacencyProfitCalculator;
import com.notropolis.economy.progression.LevelStatus;
import com.notropolis.economy.progression.ProgressionTracker;
import com.notropolis.economy.recompute.MapLeaseRegistry;
import com.notropolis.economy.recompute.RecomputeEngine;
import com.notropolis.economy.store.GameStore;
import com.notropolis.economy.store.IdGenerator;
import com.notropolis.economy.store.UuidIdGenerator;
import com.notropolis.economy.tick.TickProcessor;
import com.notropolis.economy.tick.TickSummary;

import lombok.Getter;

/**
 * Wires the economy core around one store and exposes the operations callers use.
 */
public class EconomyEngine {

    @Getter
    private final GameCatalog catalog;
    @Getter
    private final EngineConfig config;

    private final DirtyTracker dirtyTracker;
    private final RecomputeEngine recomputeEngine;
    private final ProgressionTracker progression;
    private final GameActionService actions;
    private final PrisonService prison;
    private final BuildingConditionService conditions;
    private final TickProcessor tickProcessor;
    @Getter
    private final FollowUpQueue followUpQueue;

    public EconomyEngine(GameStore store, EngineConfig config) {
        this(store, config, new CatalogLoader().load(config), new UuidIdGenerator(), Clock.systemUTC());
    }

    public EconomyEngine(GameStore store, EngineConfig config, GameCatalog catalog, IdGenerator ids, Clock clock) {
        this.catalog = catalog;
        this.config = config;

        AdjacencyProfitCalculator calculator = new AdjacencyProfitCalculator(config.getAdjacencyRadius());
        ActionGate gate = new ActionGate();

        this.dirtyTracker = new DirtyTracker(store, config.getAdjacencyRadius());
        this.recomputeEngine = new RecomputeEngine(store, catalog.getBuildings(), calculator,
                new MapLeaseRegistry(config.getLeaseWaitTimeout()), config.getRecomputeBudget(), clock);
        this.progression = new ProgressionTracker(store, catalog, ids, clock);
        this.followUpQueue = new FollowUpQueue();

        ActionFollowUps followUps = new ActionFollowUps(dirtyTracker, progression, followUpQueue);
        this.actions = new GameActionService(store, catalog.getBuildings(), gate,
                new LandPricer(config.getBaseLandPrice()), calculator, followUps, ids, clock, config);
        this.prison = new PrisonService(store, gate, followUps, ids, clock);
        this.conditions = new BuildingConditionService(store, followUps);
        this.tickProcessor = new TickProcessor(store, recomputeEngine, followUpQueue, followUps, ids, clock, config);
    }

    public BuyLandResult buyLand(String companyId, int x, int y) {
        return actions.buyLand(companyId, x, y);
    }

    public BuildResult build(String companyId, String tileId, String buildingTypeId) {
        return actions.build(companyId, tileId, buildingTypeId);
    }

    public ProfitPreview previewProfit(String tileId, String buildingTypeId) {
        return actions.previewProfit(tileId, buildingTypeId);
    }

    public ActionResult demolish(String companyId, String buildingId) {
        return actions.demolish(companyId, buildingId);
    }

    public ActionResult listForSale(String companyId, String buildingId, long price) {
        return actions.listForSale(companyId, buildingId, price);
    }

    public ActionResult cancelListing(String companyId, String buildingId) {
        return actions.cancelListing(companyId, buildingId);
    }

    public ActionResult buyProperty(String companyId, String buildingId) {
        return actions.buyProperty(companyId, buildingId);
    }

    public void imprison(String companyId, long fine) {
        prison.imprison(companyId, fine);
    }

    public PayFineResult payFine(String companyId) {
        return prison.payFine(companyId);
    }

    public BuildingInstance applyDamage(String buildingId, int damagePercent) {
        return conditions.applyDamage(buildingId, damagePercent);
    }

    public int markDirty(String mapId, int x, int y) {
        return dirtyTracker.markDirty(mapId, x, y);
    }

    public int recompute(String mapId) {
        return recomputeEngine.recompute(mapId);
    }

    public LevelStatus getLevelStatus(String companyId) {
        return progression.getLevelStatus(companyId);
    }

    public TickSummary processTick() {
        return tickProcessor.processTick();
    }
}
