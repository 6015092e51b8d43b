package com.notropolis.economy.action;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

import com.notropolis.economy.dirty.DirtyTracker;
import com.notropolis.economy.model.GridCoord;
import com.notropolis.economy.progression.LevelUp;
import com.notropolis.economy.progression.ProgressionTracker;

import lombok.RequiredArgsConstructor;

/**
 * The steps every committed action runs afterwards: mark the neighborhood dirty
 * where the map changed, then check progression for each company whose totals
 * changed. A failing step is queued rather than lost.
 */
@RequiredArgsConstructor
public class ActionFollowUps {

    private final DirtyTracker dirtyTracker;
    private final ProgressionTracker progression;
    private final FollowUpQueue queue;

    public void markDirty(String mapId, GridCoord coord) {
        queue.runOrQueue("mark dirty around " + coord + " on map " + mapId,
                () -> dirtyTracker.markDirty(mapId, coord.getX(), coord.getY()));
    }

    /**
     * @return level-ups that happened; a check that failed and was queued contributes none
     */
    public List<LevelUp> checkLevels(Collection<String> companyIds) {
        List<LevelUp> levelUps = new ArrayList<>();
        for (String companyId : new LinkedHashSet<>(companyIds)) {
            queue.runOrQueue("level check for company " + companyId,
                    () -> progression.checkLevelUp(companyId).ifPresent(levelUps::add));
        }
        return levelUps;
    }

    public Optional<LevelUp> checkLevel(String companyId) {
        List<LevelUp> levelUps = checkLevels(List.of(companyId));
        return levelUps.isEmpty() ? Optional.empty() : Optional.of(levelUps.get(0));
    }
}
