package com.notropolis.economy.support;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import com.notropolis.economy.EconomyEngine;
import com.notropolis.economy.catalog.CatalogLoader;
import com.notropolis.economy.catalog.GameCatalog;
import com.notropolis.economy.config.EngineConfig;
import com.notropolis.economy.model.BuildingInstance;
import com.notropolis.economy.model.Company;
import com.notropolis.economy.model.GameMap;
import com.notropolis.economy.model.LocationTier;
import com.notropolis.economy.model.ProfitCache;
import com.notropolis.economy.model.TerrainType;
import com.notropolis.economy.model.Tile;
import com.notropolis.economy.store.InMemoryGameStore;

/**
 * Builds small in-memory worlds from character grids.
 * <pre>
 *   . open land   R road   W water   D dirt track   T wooded
 * </pre>
 * Row index is y, column index is x.
 */
public class TestWorld {

    public static final String MAP_ID = "map-1";
    public static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private static final GameCatalog CATALOG = new CatalogLoader().load(EngineConfig.defaults());

    private final InMemoryGameStore store = new InMemoryGameStore();

    private TestWorld() {
    }

    public static TestWorld grid(String... rows) {
        return grid(LocationTier.TOWN, rows);
    }

    public static TestWorld grid(LocationTier tier, String... rows) {
        TestWorld world = new TestWorld();
        world.store.putMap(GameMap.builder()
                .id(MAP_ID)
                .name("Testerville")
                .width(rows[0].length())
                .height(rows.length)
                .locationTier(tier)
                .build());
        for (int y = 0; y < rows.length; y++) {
            for (int x = 0; x < rows[y].length(); x++) {
                world.store.putTile(Tile.builder()
                        .id(tileId(x, y))
                        .mapId(MAP_ID)
                        .x(x)
                        .y(y)
                        .terrain(terrain(rows[y].charAt(x)))
                        .build());
            }
        }
        return world;
    }

    public static String tileId(int x, int y) {
        return "t-" + x + "-" + y;
    }

    public static GameCatalog catalog() {
        return CATALOG;
    }

    public static Clock clock() {
        return Clock.fixed(NOW, ZoneOffset.UTC);
    }

    public InMemoryGameStore store() {
        return store;
    }

    public EconomyEngine engine() {
        return engine(EngineConfig.defaults());
    }

    public EconomyEngine engine(EngineConfig config) {
        return new EconomyEngine(store, config, CATALOG, new SequentialIdGenerator(), clock());
    }

    public TestWorld company(String id, long cash) {
        return company(Company.builder().id(id).userId("user-" + id).name(id).currentMapId(MAP_ID).cash(cash).build());
    }

    public TestWorld company(Company company) {
        store.putCompany(company);
        return this;
    }

    public TestWorld owns(String companyId, int x, int y) {
        Tile tile = store.loadTile(tileId(x, y)).orElseThrow();
        tile.setOwnerCompanyId(companyId);
        tile.setPurchasedAt(NOW);
        store.putTile(tile);
        return this;
    }

    /**
     * Places a clean building on (x,y) and gives its owner the tile.
     */
    public TestWorld building(String id, int x, int y, String typeId, String ownerId) {
        return building(BuildingInstance.builder()
                .id(id)
                .tileId(tileId(x, y))
                .mapId(MAP_ID)
                .buildingTypeId(typeId)
                .companyId(ownerId)
                .profitCache(ProfitCache.builder().build())
                .builtAt(NOW)
                .build());
    }

    public TestWorld building(BuildingInstance building) {
        Tile tile = store.loadTile(building.getTileId()).orElseThrow();
        owns(building.getCompanyId(), tile.getX(), tile.getY());
        store.putBuilding(building);
        return this;
    }

    public Company company(String id) {
        return store.loadCompany(id).orElseThrow();
    }

    public BuildingInstance building(String id) {
        return store.loadBuilding(id).orElseThrow();
    }

    public Tile tile(int x, int y) {
        return store.loadTile(tileId(x, y)).orElseThrow();
    }

    private static TerrainType terrain(char c) {
        return switch (c) {
            case '.' -> TerrainType.OPEN_LAND;
            case 'R' -> TerrainType.ROAD;
            case 'W' -> TerrainType.WATER;
            case 'D' -> TerrainType.DIRT_TRACK;
            case 'T' -> TerrainType.WOODED;
            default -> throw new IllegalArgumentException("Unknown terrain char: " + c);
        };
    }
}
