package com.notropolis.economy.grid;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.notropolis.economy.model.BuildingInstance;
import com.notropolis.economy.model.GridCoord;
import com.notropolis.economy.model.Tile;

/**
 * Coordinate-keyed lookup of tiles and standing buildings for one map, built
 * once per pass from persisted rows. Collapsed buildings are left out so they
 * never count as a neighbor.
 */
public final class GridIndex {

    private final Map<GridCoord, Tile> tiles;
    private final Map<GridCoord, BuildingInstance> buildings;
    private final Map<String, GridCoord> coordByTileId;

    private GridIndex(Map<GridCoord, Tile> tiles, Map<GridCoord, BuildingInstance> buildings,
            Map<String, GridCoord> coordByTileId) {
        this.tiles = tiles;
        this.buildings = buildings;
        this.coordByTileId = coordByTileId;
    }

    public static GridIndex build(Collection<Tile> tileRows, Collection<BuildingInstance> buildingRows) {
        Map<GridCoord, Tile> tiles = new HashMap<>();
        Map<String, GridCoord> coordByTileId = new HashMap<>();
        for (Tile tile : tileRows) {
            GridCoord coord = tile.getCoord();
            if (tiles.putIfAbsent(coord, tile) != null) {
                throw new IllegalArgumentException("Duplicate tile coordinate " + coord);
            }
            coordByTileId.put(tile.getId(), coord);
        }

        Map<GridCoord, BuildingInstance> buildings = new HashMap<>();
        for (BuildingInstance building : buildingRows) {
            if (building.isCollapsed()) {
                continue;
            }
            GridCoord coord = coordByTileId.get(building.getTileId());
            if (coord == null) {
                throw new IllegalArgumentException("Building " + building.getId() + " sits on unknown tile " + building.getTileId());
            }
            buildings.put(coord, building);
        }
        return new GridIndex(tiles, buildings, coordByTileId);
    }

    public Optional<Tile> tileAt(GridCoord coord) {
        return Optional.ofNullable(tiles.get(coord));
    }

    public Optional<BuildingInstance> buildingAt(GridCoord coord) {
        return Optional.ofNullable(buildings.get(coord));
    }

    public Optional<GridCoord> coordOf(BuildingInstance building) {
        return Optional.ofNullable(coordByTileId.get(building.getTileId()));
    }

    /**
     * Coordinates within Chebyshev distance {@code radius} of {@code center},
     * center excluded, in a fixed order. Coordinates outside the map are included;
     * lookups on them simply come back empty.
     */
    public static List<GridCoord> window(GridCoord center, int radius) {
        List<GridCoord> coords = new ArrayList<>((2 * radius + 1) * (2 * radius + 1) - 1);
        for (int dx = -radius; dx <= radius; dx++) {
            for (int dy = -radius; dy <= radius; dy++) {
                if (dx == 0 && dy == 0) {
                    continue;
                }
                coords.add(center.offset(dx, dy));
            }
        }
        return coords;
    }

    public List<Tile> neighborTiles(GridCoord center, int radius) {
        List<Tile> result = new ArrayList<>();
        for (GridCoord coord : window(center, radius)) {
            Tile tile = tiles.get(coord);
            if (tile != null) {
                result.add(tile);
            }
        }
        return result;
    }

    public List<BuildingInstance> neighborBuildings(GridCoord center, int radius) {
        List<BuildingInstance> result = new ArrayList<>();
        for (GridCoord coord : window(center, radius)) {
            BuildingInstance building = buildings.get(coord);
            if (building != null) {
                result.add(building);
            }
        }
        return result;
    }

    public int tileCount() {
        return tiles.size();
    }

    public int buildingCount() {
        return buildings.size();
    }
}
