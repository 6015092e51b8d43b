package com.notropolis.economy.dirty;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.notropolis.economy.error.NotFoundException;
import com.notropolis.economy.model.BuildingInstance;
import com.notropolis.economy.model.GridCoord;
import com.notropolis.economy.model.Tile;
import com.notropolis.economy.store.GameStore;
import com.notropolis.economy.store.RowMutation;

import lombok.RequiredArgsConstructor;

/**
 * Flags the cached profit of every standing building around a map event as stale.
 * Never recomputes anything itself.
 */
@RequiredArgsConstructor
public class DirtyTracker {

    private static final Logger log = LoggerFactory.getLogger(DirtyTracker.class);

    private final GameStore store;
    private final int radius;

    /**
     * Marks every non-collapsed building within Chebyshev distance {@code radius}
     * of ({@code x}, {@code y}) dirty. Marking an already dirty building leaves it dirty.
     *
     * @return number of buildings flagged
     */
    public int markDirty(String mapId, int x, int y) {
        store.loadMap(mapId).orElseThrow(() -> new NotFoundException("Map", mapId));
        GridCoord center = GridCoord.of(x, y);

        Map<String, GridCoord> coordByTileId = new HashMap<>();
        for (Tile tile : store.loadTiles(mapId)) {
            coordByTileId.put(tile.getId(), tile.getCoord());
        }

        List<RowMutation> marks = store.loadBuildings(mapId, false).stream()
                .filter(b -> !b.isCollapsed())
                .filter(b -> inRange(coordByTileId.get(b.getTileId()), center))
                .map(BuildingInstance::getId)
                .<RowMutation>map(RowMutation.MarkDirty::new)
                .collect(Collectors.toList());

        if (marks.isEmpty()) {
            log.debug("No buildings to mark around {} on map {}", center, mapId);
            return 0;
        }
        store.batchWrite(marks);
        log.debug("Marked {} buildings dirty around {} on map {}", marks.size(), center, mapId);
        return marks.size();
    }

    private boolean inRange(GridCoord coord, GridCoord center) {
        return coord != null && coord.distanceTo(center) <= radius;
    }
}
