package com.notropolis.economy.catalog;

import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JSON shape of one building type entry. Adjacency maps are keyed by terrain
 * catalog key, plus the pseudo-key {@code commercial} for neighboring buildings.
 */
@Data
@NoArgsConstructor
public class BuildingTypeDefinition {
    private String id;
    private String name;
    private long cost;
    private long baseProfit;
    private int levelRequired = 1;
    private boolean requiresLicense;
    private Map<String, Double> adjacencyBonuses = new LinkedHashMap<>();
    private Map<String, Double> adjacencyPenalties = new LinkedHashMap<>();
    private Integer maxPerMap;
}
