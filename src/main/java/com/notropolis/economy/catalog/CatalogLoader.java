package com.notropolis.economy.catalog;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.notropolis.economy.config.EngineConfig;
import com.notropolis.economy.model.BuildingType;
import com.notropolis.economy.model.TerrainType;

/**
 * Loads the immutable reference catalogs from classpath JSON resources.
 */
public class CatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(CatalogLoader.class);

    static final String COMMERCIAL_KEY = "commercial";

    private final ObjectMapper mapper;

    public CatalogLoader() {
        this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public CatalogLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public GameCatalog load(EngineConfig config) {
        List<BuildingTypeDefinition> typeDefs = read(config.getBuildingTypesResource(),
                new TypeReference<List<BuildingTypeDefinition>>() {
                });
        List<LevelTierDefinition> tierDefs = read(config.getLevelTiersResource(),
                new TypeReference<List<LevelTierDefinition>>() {
                });

        List<BuildingType> types = new ArrayList<>();
        for (BuildingTypeDefinition def : typeDefs) {
            types.add(toBuildingType(def));
        }

        List<LevelTier> tiers = new ArrayList<>();
        Map<Integer, List<String>> unlocks = new LinkedHashMap<>();
        for (LevelTierDefinition def : tierDefs) {
            tiers.add(new LevelTier(def.getLevel(), def.getCashRequired(), def.getActionsRequired()));
            unlocks.put(def.getLevel(), List.copyOf(def.getActionUnlocks()));
        }

        GameCatalog catalog = new GameCatalog(new BuildingCatalog(types), new LevelCatalog(tiers),
                new ActionUnlockCatalog(unlocks));
        log.info("Loaded catalog: {} building types, {} level tiers", types.size(), tiers.size());
        return catalog;
    }

    BuildingType toBuildingType(BuildingTypeDefinition def) {
        if (def.getId() == null || def.getId().isBlank()) {
            throw new IllegalArgumentException("Building type without id in catalog");
        }
        BuildingType.BuildingTypeBuilder builder = BuildingType.builder()
                .id(def.getId())
                .name(def.getName() != null ? def.getName() : def.getId())
                .cost(def.getCost())
                .baseProfit(def.getBaseProfit())
                .levelRequired(def.getLevelRequired())
                .requiresLicense(def.isRequiresLicense())
                .maxPerMap(def.getMaxPerMap());

        for (Map.Entry<String, Double> e : def.getAdjacencyBonuses().entrySet()) {
            if (COMMERCIAL_KEY.equals(e.getKey())) {
                builder.commercialBonus(e.getValue());
            } else {
                builder.terrainBonus(terrainKey(def.getId(), e.getKey()), e.getValue());
            }
        }
        for (Map.Entry<String, Double> e : def.getAdjacencyPenalties().entrySet()) {
            if (COMMERCIAL_KEY.equals(e.getKey())) {
                builder.commercialPenalty(e.getValue());
            } else {
                builder.terrainPenalty(terrainKey(def.getId(), e.getKey()), e.getValue());
            }
        }
        return builder.build();
    }

    private static TerrainType terrainKey(String typeId, String key) {
        return TerrainType.fromCatalogKey(key)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unknown terrain '" + key + "' in adjacency rules of building type " + typeId));
    }

    private <T> T read(String resource, TypeReference<T> type) {
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Catalog resource not found on classpath: " + resource);
            }
            return mapper.readValue(in, type);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read catalog resource " + resource, e);
        }
    }
}
