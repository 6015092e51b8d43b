package com.notropolis.economy.store;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.notropolis.economy.error.ConflictException;
import com.notropolis.economy.model.BuildingInstance;
import com.notropolis.economy.model.Company;
import com.notropolis.economy.model.GameMap;
import com.notropolis.economy.model.Tile;
import com.notropolis.economy.model.TransactionLogEntry;
import com.notropolis.economy.store.RowMutation.AdjustCash;
import com.notropolis.economy.store.RowMutation.AdvanceIdleTicks;
import com.notropolis.economy.store.RowMutation.AppendLog;
import com.notropolis.economy.store.RowMutation.ClaimTile;
import com.notropolis.economy.store.RowMutation.CommitProfit;
import com.notropolis.economy.store.RowMutation.DeleteBuilding;
import com.notropolis.economy.store.RowMutation.InsertBuilding;
import com.notropolis.economy.store.RowMutation.MarkDirty;
import com.notropolis.economy.store.RowMutation.RaiseLevel;
import com.notropolis.economy.store.RowMutation.RecordAction;
import com.notropolis.economy.store.RowMutation.RequireTypeCountBelow;
import com.notropolis.economy.store.RowMutation.SetCondition;
import com.notropolis.economy.store.RowMutation.SetPrison;
import com.notropolis.economy.store.RowMutation.TransferBuilding;
import com.notropolis.economy.store.RowMutation.UpdateListing;

/**
 * Single-process {@link GameStore}. Batches are staged on copies and published
 * only when every guard holds, so a failing batch leaves no trace.
 */
public class InMemoryGameStore implements GameStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryGameStore.class);

    private final Object lock = new Object();

    private final Map<String, GameMap> maps = new LinkedHashMap<>();
    private final Map<String, Tile> tiles = new LinkedHashMap<>();
    private final Map<String, BuildingInstance> buildings = new LinkedHashMap<>();
    private final Map<String, Company> companies = new LinkedHashMap<>();
    private final Map<String, String> buildingIdByTile = new HashMap<>();
    private final List<TransactionLogEntry> transactionLog = new ArrayList<>();

    // ---- seeding ----

    public void putMap(GameMap map) {
        synchronized (lock) {
            maps.put(map.getId(), map);
        }
    }

    public void putTile(Tile tile) {
        synchronized (lock) {
            if (!maps.containsKey(tile.getMapId())) {
                throw new IllegalArgumentException("Unknown map " + tile.getMapId() + " for tile " + tile.getId());
            }
            boolean clash = tiles.values().stream()
                    .anyMatch(t -> !t.getId().equals(tile.getId())
                            && t.getMapId().equals(tile.getMapId())
                            && t.getX() == tile.getX() && t.getY() == tile.getY());
            if (clash) {
                throw new IllegalArgumentException("Duplicate coordinate " + tile.getCoord() + " on map " + tile.getMapId());
            }
            if (tile.isOwned() && !tile.isOwnable()) {
                throw new IllegalArgumentException("Tile " + tile.getId() + " cannot carry an owner");
            }
            tiles.put(tile.getId(), tile.toBuilder().build());
        }
    }

    public void putCompany(Company company) {
        synchronized (lock) {
            companies.put(company.getId(), company.toBuilder().build());
        }
    }

    public void putBuilding(BuildingInstance building) {
        synchronized (lock) {
            Tile tile = tiles.get(building.getTileId());
            if (tile == null) {
                throw new IllegalArgumentException("Unknown tile " + building.getTileId() + " for building " + building.getId());
            }
            String existing = buildingIdByTile.get(tile.getId());
            if (existing != null && !existing.equals(building.getId())) {
                throw new IllegalArgumentException("Tile " + tile.getId() + " already hosts building " + existing);
            }
            BuildingInstance copy = building.toBuilder().mapId(tile.getMapId()).build();
            buildings.put(copy.getId(), copy);
            buildingIdByTile.put(tile.getId(), copy.getId());
        }
    }

    // ---- reads ----

    @Override
    public Optional<GameMap> loadMap(String mapId) {
        synchronized (lock) {
            return Optional.ofNullable(maps.get(mapId));
        }
    }

    @Override
    public List<GameMap> loadMaps() {
        synchronized (lock) {
            return List.copyOf(maps.values());
        }
    }

    @Override
    public List<Tile> loadTiles(String mapId) {
        synchronized (lock) {
            return tiles.values().stream()
                    .filter(t -> t.getMapId().equals(mapId))
                    .map(t -> t.toBuilder().build())
                    .collect(Collectors.toList());
        }
    }

    @Override
    public Optional<Tile> loadTile(String tileId) {
        synchronized (lock) {
            return Optional.ofNullable(tiles.get(tileId)).map(t -> t.toBuilder().build());
        }
    }

    @Override
    public Optional<Tile> findTile(String mapId, int x, int y) {
        synchronized (lock) {
            return tiles.values().stream()
                    .filter(t -> t.getMapId().equals(mapId) && t.getX() == x && t.getY() == y)
                    .findFirst()
                    .map(t -> t.toBuilder().build());
        }
    }

    @Override
    public List<BuildingInstance> loadBuildings(String mapId, boolean onlyDirty) {
        synchronized (lock) {
            return buildings.values().stream()
                    .filter(b -> b.getMapId().equals(mapId))
                    .filter(b -> !onlyDirty || b.isDirty())
                    .map(b -> b.toBuilder().build())
                    .collect(Collectors.toList());
        }
    }

    @Override
    public Optional<BuildingInstance> loadBuilding(String buildingId) {
        synchronized (lock) {
            return Optional.ofNullable(buildings.get(buildingId)).map(b -> b.toBuilder().build());
        }
    }

    @Override
    public Optional<BuildingInstance> findBuildingOnTile(String tileId) {
        synchronized (lock) {
            return Optional.ofNullable(buildingIdByTile.get(tileId))
                    .map(buildings::get)
                    .map(b -> b.toBuilder().build());
        }
    }

    @Override
    public Optional<Company> loadCompany(String companyId) {
        synchronized (lock) {
            return Optional.ofNullable(companies.get(companyId)).map(c -> c.toBuilder().build());
        }
    }

    @Override
    public List<Company> loadCompaniesOnMap(String mapId) {
        synchronized (lock) {
            return companies.values().stream()
                    .filter(c -> Objects.equals(c.getCurrentMapId(), mapId))
                    .map(c -> c.toBuilder().build())
                    .collect(Collectors.toList());
        }
    }

    @Override
    public List<TransactionLogEntry> loadLog(String companyId) {
        synchronized (lock) {
            return transactionLog.stream()
                    .filter(e -> e.getCompanyId().equals(companyId))
                    .sorted(Comparator.comparing(TransactionLogEntry::getCreatedAt))
                    .collect(Collectors.toList());
        }
    }

    // ---- snapshots ----

    public static InMemoryGameStore fromSnapshot(WorldSnapshot snapshot) {
        InMemoryGameStore store = new InMemoryGameStore();
        snapshot.getMaps().forEach(store::putMap);
        snapshot.getTiles().forEach(store::putTile);
        snapshot.getCompanies().forEach(store::putCompany);
        snapshot.getBuildings().forEach(store::putBuilding);
        synchronized (store.lock) {
            store.transactionLog.addAll(snapshot.getTransactions());
        }
        return store;
    }

    public WorldSnapshot toSnapshot() {
        synchronized (lock) {
            return WorldSnapshot.builder()
                    .maps(maps.values())
                    .tiles(tiles.values())
                    .companies(companies.values())
                    .buildings(buildings.values())
                    .transactions(transactionLog)
                    .build();
        }
    }

    // ---- writes ----

    @Override
    public void appendLog(TransactionLogEntry entry) {
        batchWrite(List.of(new AppendLog(entry)));
    }

    @Override
    public void batchWrite(List<RowMutation> mutations) {
        if (mutations == null || mutations.isEmpty()) {
            return;
        }
        synchronized (lock) {
            Staging staging = new Staging();
            for (RowMutation mutation : mutations) {
                staging.apply(mutation);
            }
            staging.publish();
            log.debug("Committed batch of {} mutations", mutations.size());
        }
    }

    /**
     * Working copies of every row a batch touches.
     */
    private final class Staging {
        private final Map<String, Tile> stagedTiles = new HashMap<>();
        private final Map<String, BuildingInstance> stagedBuildings = new HashMap<>();
        private final Set<String> deletedBuildings = new HashSet<>();
        private final Map<String, Company> stagedCompanies = new HashMap<>();
        private final List<TransactionLogEntry> stagedLog = new ArrayList<>();

        void apply(RowMutation mutation) {
            if (mutation instanceof ClaimTile m) {
                Tile tile = tile(m.getTileId());
                if (!Objects.equals(tile.getOwnerCompanyId(), m.getExpectedOwnerId())) {
                    throw new ConflictException("Tile " + tile.getCoord() + " changed owner before the write");
                }
                if (m.getNewOwnerId() != null && !tile.isOwnable()) {
                    throw new ConflictException("Tile " + tile.getCoord() + " cannot carry an owner");
                }
                tile.setOwnerCompanyId(m.getNewOwnerId());
                tile.setPurchasedAt(m.getNewOwnerId() == null ? null : m.getAt());
            } else if (mutation instanceof InsertBuilding m) {
                BuildingInstance b = m.getBuilding().toBuilder().build();
                tile(b.getTileId());
                if (occupant(b.getTileId()) != null) {
                    throw new ConflictException("Tile " + b.getTileId() + " already hosts a building");
                }
                if (buildings.containsKey(b.getId()) || stagedBuildings.containsKey(b.getId())) {
                    throw new ConflictException("Building id already in use: " + b.getId());
                }
                stagedBuildings.put(b.getId(), b);
            } else if (mutation instanceof RequireTypeCountBelow m) {
                long count = countOfType(m.getMapId(), m.getBuildingTypeId());
                if (count >= m.getLimit()) {
                    throw new ConflictException("Map " + m.getMapId() + " already has " + count + " buildings of type "
                            + m.getBuildingTypeId() + " (limit " + m.getLimit() + ")");
                }
            } else if (mutation instanceof DeleteBuilding m) {
                building(m.getBuildingId());
                stagedBuildings.remove(m.getBuildingId());
                deletedBuildings.add(m.getBuildingId());
            } else if (mutation instanceof TransferBuilding m) {
                BuildingInstance b = building(m.getBuildingId());
                if (!b.getCompanyId().equals(m.getExpectedOwnerId())) {
                    throw new ConflictException("Building " + b.getId() + " changed owner before the write");
                }
                if (m.isRequireListed() && !b.isForSale()) {
                    throw new ConflictException("Building " + b.getId() + " is no longer for sale");
                }
                b.setCompanyId(m.getNewOwnerId());
                b.setForSale(false);
                b.setSalePrice(null);
            } else if (mutation instanceof UpdateListing m) {
                BuildingInstance b = building(m.getBuildingId());
                if (!b.getCompanyId().equals(m.getExpectedOwnerId())) {
                    throw new ConflictException("Building " + b.getId() + " changed owner before the write");
                }
                b.setForSale(m.isForSale());
                b.setSalePrice(m.isForSale() ? m.getPrice() : null);
            } else if (mutation instanceof SetCondition m) {
                BuildingInstance b = building(m.getBuildingId());
                b.setDamagePercent(m.getDamagePercent());
                b.setOnFire(m.isOnFire());
                b.setCollapsed(m.isCollapsed());
            } else if (mutation instanceof MarkDirty m) {
                BuildingInstance b = building(m.getBuildingId());
                b.setProfitCache(b.getProfitCache().markDirty());
            } else if (mutation instanceof CommitProfit m) {
                BuildingInstance b = building(m.getBuildingId());
                b.setProfitCache(b.getProfitCache().commit(m.getProfit(), m.getBreakdown(), m.getSnapshotVersion()));
            } else if (mutation instanceof AdjustCash m) {
                Company c = company(m.getCompanyId());
                long next = c.getCash() + m.getDelta();
                if (m.isRequireCovered() && next < 0) {
                    throw new ConflictException("Balance of company " + c.getId() + " changed before the write");
                }
                c.setCash(next);
            } else if (mutation instanceof RecordAction m) {
                Company c = company(m.getCompanyId());
                c.setTotalActions(c.getTotalActions() + 1);
                c.setLastActionAt(m.getAt());
                c.setTicksSinceAction(0);
            } else if (mutation instanceof AdvanceIdleTicks m) {
                Company c = company(m.getCompanyId());
                c.setTicksSinceAction(c.getTicksSinceAction() + 1);
            } else if (mutation instanceof SetPrison m) {
                Company c = company(m.getCompanyId());
                if (c.isImprisoned() == m.isImprisoned()) {
                    throw new ConflictException("Prison state of company " + c.getId() + " changed before the write");
                }
                c.setImprisoned(m.isImprisoned());
                c.setPrisonFine(m.isImprisoned() ? m.getFine() : 0L);
            } else if (mutation instanceof RaiseLevel m) {
                Company c = company(m.getCompanyId());
                c.setLevel(Math.max(c.getLevel(), m.getLevel()));
            } else if (mutation instanceof AppendLog m) {
                stagedLog.add(m.getEntry());
            } else {
                throw new IllegalArgumentException("Unsupported mutation: " + mutation.getClass().getName());
            }
        }

        void publish() {
            tiles.putAll(stagedTiles);
            for (String id : deletedBuildings) {
                BuildingInstance removed = buildings.remove(id);
                if (removed != null) {
                    buildingIdByTile.remove(removed.getTileId(), id);
                }
            }
            for (BuildingInstance b : stagedBuildings.values()) {
                buildings.put(b.getId(), b);
                buildingIdByTile.put(b.getTileId(), b.getId());
            }
            companies.putAll(stagedCompanies);
            transactionLog.addAll(stagedLog);
        }

        private Tile tile(String id) {
            Tile staged = stagedTiles.get(id);
            if (staged != null) {
                return staged;
            }
            Tile committed = tiles.get(id);
            if (committed == null) {
                throw new ConflictException("Tile " + id + " no longer exists");
            }
            Tile copy = committed.toBuilder().build();
            stagedTiles.put(id, copy);
            return copy;
        }

        private BuildingInstance building(String id) {
            if (deletedBuildings.contains(id)) {
                throw new ConflictException("Building " + id + " no longer exists");
            }
            BuildingInstance staged = stagedBuildings.get(id);
            if (staged != null) {
                return staged;
            }
            BuildingInstance committed = buildings.get(id);
            if (committed == null) {
                throw new ConflictException("Building " + id + " no longer exists");
            }
            BuildingInstance copy = committed.toBuilder().build();
            stagedBuildings.put(id, copy);
            return copy;
        }

        private Company company(String id) {
            Company staged = stagedCompanies.get(id);
            if (staged != null) {
                return staged;
            }
            Company committed = companies.get(id);
            if (committed == null) {
                throw new ConflictException("Company " + id + " no longer exists");
            }
            Company copy = committed.toBuilder().build();
            stagedCompanies.put(id, copy);
            return copy;
        }

        private long countOfType(String mapId, String buildingTypeId) {
            Map<String, BuildingInstance> visible = new HashMap<>(buildings);
            visible.putAll(stagedBuildings);
            deletedBuildings.forEach(visible::remove);
            return visible.values().stream()
                    .filter(b -> b.getMapId().equals(mapId) && b.getBuildingTypeId().equals(buildingTypeId))
                    .count();
        }

        private String occupant(String tileId) {
            for (BuildingInstance b : stagedBuildings.values()) {
                if (b.getTileId().equals(tileId)) {
                    return b.getId();
                }
            }
            String committed = buildingIdByTile.get(tileId);
            return committed == null || deletedBuildings.contains(committed) ? null : committed;
        }
    }
}
