package com.notropolis.economy.action;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.notropolis.economy.catalog.BuildingCatalog;
import com.notropolis.economy.config.EngineConfig;
import com.notropolis.economy.error.ConflictException;
import com.notropolis.economy.error.InternalException;
import com.notropolis.economy.error.NotFoundException;
import com.notropolis.economy.error.PreconditionException;
import com.notropolis.economy.error.PreconditionException.Reason;
import com.notropolis.economy.error.ValidationException;
import com.notropolis.economy.gate.ActionGate;
import com.notropolis.economy.grid.GridIndex;
import com.notropolis.economy.model.ActionKind;
import com.notropolis.economy.model.BuildingInstance;
import com.notropolis.economy.model.BuildingType;
import com.notropolis.economy.model.Company;
import com.notropolis.economy.model.GameMap;
import com.notropolis.economy.model.ProfitCache;
import com.notropolis.economy.model.Tile;
import com.notropolis.economy.model.TransactionLogEntry;
import com.notropolis.economy.profit.AdjacencyProfitCalculator;
import com.notropolis.economy.profit.ProfitResult;
import com.notropolis.economy.progression.LevelUp;
import com.notropolis.economy.store.GameStore;
import com.notropolis.economy.store.IdGenerator;
import com.notropolis.economy.store.RowMutation;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Company-initiated map actions.
 * <p>
 * Every action checks the prison gate first, validates against freshly loaded
 * rows, then writes its effect, the balance and counter changes and its log
 * entry as one conditional batch. Dirty marks and level checks follow the
 * commit and are queued for retry if they fail.
 */
@RequiredArgsConstructor
public class GameActionService {

    private static final Logger log = LoggerFactory.getLogger(GameActionService.class);

    @NonNull
    private final GameStore store;
    @NonNull
    private final BuildingCatalog buildingTypes;
    @NonNull
    private final ActionGate gate;
    @NonNull
    private final LandPricer landPricer;
    @NonNull
    private final AdjacencyProfitCalculator calculator;
    @NonNull
    private final ActionFollowUps followUps;
    @NonNull
    private final IdGenerator ids;
    @NonNull
    private final Clock clock;
    @NonNull
    private final EngineConfig config;

    public BuyLandResult buyLand(String companyId, int x, int y) {
        Company company = requireCompany(companyId);
        gate.check(company, ActionKind.BUY_LAND);

        String mapId = requireCurrentMap(company);
        GameMap map = store.loadMap(mapId).orElseThrow(() -> new NotFoundException("Map", mapId));
        Tile tile = store.findTile(mapId, x, y)
                .orElseThrow(() -> new NotFoundException("No tile at (" + x + "," + y + ") on map " + mapId));

        long price = landPricer.price(tile, map);
        if (tile.isOwned()) {
            if (tile.getOwnerCompanyId().equals(companyId)) {
                throw new ValidationException("Company " + companyId + " already owns tile " + tile.getCoord());
            }
            throw new ConflictException("Tile " + tile.getCoord() + " is already owned by another company");
        }
        requireFunds(company, price, "buy tile " + tile.getCoord());

        Instant now = clock.instant();
        TransactionLogEntry entry = logEntry(company, ActionKind.BUY_LAND, price, now)
                .targetTileId(tile.getId())
                .detail("x", x)
                .detail("y", y)
                .detail("terrain", tile.getTerrain().getCatalogKey())
                .build();

        store.batchWrite(List.of(
                new RowMutation.ClaimTile(tile.getId(), null, companyId, now),
                new RowMutation.AdjustCash(companyId, -price, true),
                new RowMutation.RecordAction(companyId, now),
                new RowMutation.AppendLog(entry)));
        log.info("Company {} bought tile {} on map {} for {}", companyId, tile.getCoord(), mapId, price);

        followUps.markDirty(mapId, tile.getCoord());
        List<LevelUp> levelUps = followUps.checkLevels(List.of(companyId));

        return BuyLandResult.builder()
                .tileId(tile.getId())
                .cost(price)
                .remainingCash(cashOf(companyId))
                .levelUps(levelUps)
                .build();
    }

    public BuildResult build(String companyId, String tileId, String buildingTypeId) {
        Company company = requireCompany(companyId);
        gate.check(company, ActionKind.BUILD);
        BuildingType type = requireType(buildingTypeId);

        Tile tile = store.loadTile(tileId).orElseThrow(() -> new NotFoundException("Tile", tileId));
        String mapId = requireCurrentMap(company);
        if (!tile.getMapId().equals(mapId)) {
            throw new ValidationException("Tile " + tileId + " is not on the company's current map " + mapId);
        }
        if (!companyId.equals(tile.getOwnerCompanyId())) {
            throw new PreconditionException(Reason.NOT_OWNER,
                    "Company " + companyId + " does not own tile " + tile.getCoord());
        }
        if (store.findBuildingOnTile(tileId).isPresent()) {
            throw new ConflictException("Tile " + tile.getCoord() + " already has a building");
        }
        if (company.getLevel() < type.getLevelRequired()) {
            throw new PreconditionException(Reason.LEVEL_TOO_LOW, type.getName() + " requires level "
                    + type.getLevelRequired() + "; company is level " + company.getLevel());
        }

        List<BuildingInstance> mapBuildings = store.loadBuildings(mapId, false);
        if (type.isRequiresLicense() && type.getMaxPerMapLimit().isPresent()) {
            int cap = type.getMaxPerMapLimit().get();
            long existing = mapBuildings.stream().filter(b -> b.getBuildingTypeId().equals(type.getId())).count();
            if (existing >= cap) {
                throw new PreconditionException(Reason.LICENSE_CAP_REACHED,
                        "All " + cap + " licenses for " + type.getName() + " on map " + mapId + " are taken");
            }
        }
        requireFunds(company, type.getCost(), "build " + type.getName());

        GridIndex grid = GridIndex.build(store.loadTiles(mapId), mapBuildings);
        ProfitResult profit = calculator.calculate(type, tile.getCoord(), grid);

        Instant now = clock.instant();
        BuildingInstance building = BuildingInstance.builder()
                .id(ids.nextId())
                .tileId(tileId)
                .mapId(mapId)
                .buildingTypeId(type.getId())
                .companyId(companyId)
                .profitCache(ProfitCache.computed(profit.getProfit(), profit.getBreakdown()))
                .builtAt(now)
                .build();

        TransactionLogEntry entry = logEntry(company, ActionKind.BUILD, type.getCost(), now)
                .targetTileId(tileId)
                .targetBuildingId(building.getId())
                .detail("buildingType", type.getId())
                .detail("profit", profit.getProfit())
                .build();

        List<RowMutation> batch = new ArrayList<>();
        if (type.isRequiresLicense() && type.getMaxPerMapLimit().isPresent()) {
            batch.add(new RowMutation.RequireTypeCountBelow(mapId, type.getId(), type.getMaxPerMapLimit().get()));
        }
        batch.add(new RowMutation.InsertBuilding(building));
        batch.add(new RowMutation.AdjustCash(companyId, -type.getCost(), true));
        batch.add(new RowMutation.RecordAction(companyId, now));
        batch.add(new RowMutation.AppendLog(entry));
        store.batchWrite(batch);
        log.info("Company {} built {} at {} on map {} (profit {})", companyId, type.getId(), tile.getCoord(), mapId,
                profit.getProfit());

        followUps.markDirty(mapId, tile.getCoord());
        List<LevelUp> levelUps = followUps.checkLevels(List.of(companyId));

        return BuildResult.builder()
                .buildingId(building.getId())
                .cost(type.getCost())
                .remainingCash(cashOf(companyId))
                .profit(profit.getProfit())
                .breakdown(profit.getBreakdown())
                .levelUps(levelUps)
                .build();
    }

    /**
     * Profit a building of the given type would earn on the tile right now. Reads only.
     */
    public ProfitPreview previewProfit(String tileId, String buildingTypeId) {
        BuildingType type = requireType(buildingTypeId);
        Tile tile = store.loadTile(tileId).orElseThrow(() -> new NotFoundException("Tile", tileId));
        GridIndex grid = GridIndex.build(store.loadTiles(tile.getMapId()), store.loadBuildings(tile.getMapId(), false));
        ProfitResult profit = calculator.calculate(type, tile.getCoord(), grid);
        return new ProfitPreview(tileId, type.getId(), profit.getProfit(), profit.getBreakdown());
    }

    /**
     * Clears the ruins of a collapsed building. The tile stays with its owner.
     */
    public ActionResult demolish(String companyId, String buildingId) {
        Company company = requireCompany(companyId);
        gate.check(company, ActionKind.DEMOLISH);

        BuildingInstance building = requireOwnedBuilding(companyId, buildingId);
        if (!building.isCollapsed()) {
            throw new PreconditionException(Reason.INVALID_STATE,
                    "Building " + buildingId + " is still standing; only collapsed buildings can be demolished");
        }
        BuildingType type = typeOf(building);
        long cost = Math.round(type.getCost() * config.getDemolitionCostFraction());
        requireFunds(company, cost, "demolish " + type.getName());
        Tile tile = store.loadTile(building.getTileId())
                .orElseThrow(() -> new InternalException("Building " + buildingId + " sits on a missing tile"));

        Instant now = clock.instant();
        TransactionLogEntry entry = logEntry(company, ActionKind.DEMOLISH, cost, now)
                .targetTileId(tile.getId())
                .targetBuildingId(buildingId)
                .detail("buildingType", type.getId())
                .build();

        store.batchWrite(List.of(
                new RowMutation.DeleteBuilding(buildingId),
                new RowMutation.AdjustCash(companyId, -cost, true),
                new RowMutation.RecordAction(companyId, now),
                new RowMutation.AppendLog(entry)));
        log.info("Company {} demolished {} at {} for {}", companyId, buildingId, tile.getCoord(), cost);

        followUps.markDirty(tile.getMapId(), tile.getCoord());
        return actionResult(ActionKind.DEMOLISH, buildingId, cost, companyId, followUps.checkLevels(List.of(companyId)));
    }

    public ActionResult listForSale(String companyId, String buildingId, long price) {
        Company company = requireCompany(companyId);
        gate.check(company, ActionKind.LIST_FOR_SALE);

        BuildingInstance building = requireOwnedBuilding(companyId, buildingId);
        if (building.isCollapsed()) {
            throw new PreconditionException(Reason.INVALID_STATE, "Collapsed building " + buildingId + " cannot be sold");
        }
        if (building.isForSale()) {
            throw new PreconditionException(Reason.INVALID_STATE, "Building " + buildingId + " is already listed");
        }
        BuildingType type = typeOf(building);
        long minimum = Math.round(type.getCost() * config.getMinListingFraction());
        if (price < minimum) {
            throw new ValidationException("Listing price " + price + " is below the minimum of " + minimum
                    + " for " + type.getName());
        }

        Instant now = clock.instant();
        TransactionLogEntry entry = logEntry(company, ActionKind.LIST_FOR_SALE, price, now)
                .targetBuildingId(buildingId)
                .build();
        store.batchWrite(List.of(
                new RowMutation.UpdateListing(buildingId, companyId, true, price),
                new RowMutation.RecordAction(companyId, now),
                new RowMutation.AppendLog(entry)));
        log.info("Company {} listed {} for {}", companyId, buildingId, price);

        return actionResult(ActionKind.LIST_FOR_SALE, buildingId, price, companyId,
                followUps.checkLevels(List.of(companyId)));
    }

    public ActionResult cancelListing(String companyId, String buildingId) {
        Company company = requireCompany(companyId);
        gate.check(company, ActionKind.CANCEL_LISTING);

        BuildingInstance building = requireOwnedBuilding(companyId, buildingId);
        if (!building.isForSale()) {
            throw new PreconditionException(Reason.INVALID_STATE, "Building " + buildingId + " is not listed");
        }

        Instant now = clock.instant();
        TransactionLogEntry entry = logEntry(company, ActionKind.CANCEL_LISTING, 0L, now)
                .targetBuildingId(buildingId)
                .build();
        store.batchWrite(List.of(
                new RowMutation.UpdateListing(buildingId, companyId, false, null),
                new RowMutation.RecordAction(companyId, now),
                new RowMutation.AppendLog(entry)));
        log.info("Company {} withdrew {} from sale", companyId, buildingId);

        return actionResult(ActionKind.CANCEL_LISTING, buildingId, 0L, companyId,
                followUps.checkLevels(List.of(companyId)));
    }

    /**
     * Buys a listed building with its tile. The seller is credited passively,
     * even while imprisoned.
     */
    public ActionResult buyProperty(String companyId, String buildingId) {
        Company buyer = requireCompany(companyId);
        gate.check(buyer, ActionKind.BUY_PROPERTY);

        BuildingInstance building = store.loadBuilding(buildingId)
                .orElseThrow(() -> new NotFoundException("Building", buildingId));
        if (building.getCompanyId().equals(companyId)) {
            throw new ValidationException("Company " + companyId + " already owns building " + buildingId);
        }
        if (!building.isForSale() || building.getSalePrice() == null) {
            throw new PreconditionException(Reason.INVALID_STATE, "Building " + buildingId + " is not for sale");
        }
        if (building.isCollapsed()) {
            throw new PreconditionException(Reason.INVALID_STATE, "Collapsed building " + buildingId + " cannot be bought");
        }
        String mapId = requireCurrentMap(buyer);
        if (!building.getMapId().equals(mapId)) {
            throw new ValidationException("Building " + buildingId + " is not on the company's current map " + mapId);
        }
        long price = building.getSalePrice();
        requireFunds(buyer, price, "buy building " + buildingId);

        String sellerId = building.getCompanyId();
        Tile tile = store.loadTile(building.getTileId())
                .orElseThrow(() -> new InternalException("Building " + buildingId + " sits on a missing tile"));

        Instant now = clock.instant();
        TransactionLogEntry bought = logEntry(buyer, ActionKind.BUY_PROPERTY, price, now)
                .targetTileId(tile.getId())
                .targetBuildingId(buildingId)
                .targetCompanyId(sellerId)
                .build();
        TransactionLogEntry sold = TransactionLogEntry.builder()
                .id(ids.nextId())
                .companyId(sellerId)
                .mapId(mapId)
                .kind(ActionKind.SELL_PROPERTY)
                .targetTileId(tile.getId())
                .targetBuildingId(buildingId)
                .targetCompanyId(companyId)
                .amount(price)
                .createdAt(now)
                .build();

        store.batchWrite(List.of(
                new RowMutation.TransferBuilding(buildingId, sellerId, companyId, true),
                new RowMutation.ClaimTile(tile.getId(), sellerId, companyId, now),
                new RowMutation.AdjustCash(companyId, -price, true),
                new RowMutation.AdjustCash(sellerId, price, false),
                new RowMutation.RecordAction(companyId, now),
                new RowMutation.AppendLog(bought),
                new RowMutation.AppendLog(sold)));
        log.info("Company {} bought {} from {} for {}", companyId, buildingId, sellerId, price);

        followUps.markDirty(mapId, tile.getCoord());
        return actionResult(ActionKind.BUY_PROPERTY, buildingId, price, companyId,
                followUps.checkLevels(List.of(companyId, sellerId)));
    }

    private Company requireCompany(String companyId) {
        return store.loadCompany(companyId).orElseThrow(() -> new NotFoundException("Company", companyId));
    }

    private BuildingType requireType(String buildingTypeId) {
        return buildingTypes.find(buildingTypeId)
                .orElseThrow(() -> new ValidationException("Unknown building type: " + buildingTypeId));
    }

    private BuildingType typeOf(BuildingInstance building) {
        return buildingTypes.find(building.getBuildingTypeId())
                .orElseThrow(() -> new InternalException("Building " + building.getId()
                        + " references unknown type " + building.getBuildingTypeId()));
    }

    private BuildingInstance requireOwnedBuilding(String companyId, String buildingId) {
        BuildingInstance building = store.loadBuilding(buildingId)
                .orElseThrow(() -> new NotFoundException("Building", buildingId));
        if (!building.getCompanyId().equals(companyId)) {
            throw new PreconditionException(Reason.NOT_OWNER,
                    "Company " + companyId + " does not own building " + buildingId);
        }
        return building;
    }

    private static String requireCurrentMap(Company company) {
        if (company.getCurrentMapId() == null) {
            throw new PreconditionException(Reason.NO_MAP, "Company " + company.getId() + " has not joined a map");
        }
        return company.getCurrentMapId();
    }

    private static void requireFunds(Company company, long amount, String purpose) {
        if (company.getCash() < amount) {
            throw new PreconditionException(Reason.INSUFFICIENT_FUNDS, "Insufficient funds to " + purpose
                    + ": need " + amount + ", have " + company.getCash());
        }
    }

    private TransactionLogEntry.TransactionLogEntryBuilder logEntry(Company company, ActionKind kind, long amount,
            Instant at) {
        return TransactionLogEntry.builder()
                .id(ids.nextId())
                .companyId(company.getId())
                .mapId(company.getCurrentMapId())
                .kind(kind)
                .amount(amount)
                .createdAt(at);
    }

    private ActionResult actionResult(ActionKind kind, String targetId, long amount, String companyId,
            List<LevelUp> levelUps) {
        return ActionResult.builder()
                .action(kind)
                .targetId(targetId)
                .amount(amount)
                .remainingCash(cashOf(companyId))
                .levelUps(levelUps)
                .build();
    }

    private long cashOf(String companyId) {
        return requireCompany(companyId).getCash();
    }
}
