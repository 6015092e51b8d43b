package com.notropolis.economy.catalog;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import com.notropolis.economy.model.BuildingType;

/**
 * Read-only table of building types keyed by id, in catalog order.
 */
public final class BuildingCatalog {

    private final Map<String, BuildingType> byId;
    private final List<BuildingType> ordered;

    public BuildingCatalog(Collection<BuildingType> types) {
        Map<String, BuildingType> map = new LinkedHashMap<>();
        for (BuildingType type : types) {
            if (map.putIfAbsent(type.getId(), type) != null) {
                throw new IllegalArgumentException("Duplicate building type id: " + type.getId());
            }
        }
        this.byId = Map.copyOf(map);
        this.ordered = List.copyOf(map.values());
    }

    public Optional<BuildingType> find(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(byId.get(id));
    }

    public List<BuildingType> all() {
        return ordered;
    }

    /**
     * Types whose required level is exactly {@code level}.
     */
    public List<BuildingType> unlockedAt(int level) {
        return ordered.stream()
                .filter(t -> t.getLevelRequired() == level)
                .collect(Collectors.toList());
    }
}
