package com.notropolis.economy.action;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.notropolis.economy.error.InternalException;
import com.notropolis.economy.error.NotFoundException;
import com.notropolis.economy.model.BuildingInstance;
import com.notropolis.economy.model.Tile;
import com.notropolis.economy.store.GameStore;
import com.notropolis.economy.store.RowMutation;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Entry point for the attack and fire subsystems to change a building's condition.
 */
@RequiredArgsConstructor
public class BuildingConditionService {

    private static final Logger log = LoggerFactory.getLogger(BuildingConditionService.class);

    static final int COLLAPSE_DAMAGE = 100;

    @NonNull
    private final GameStore store;
    @NonNull
    private final ActionFollowUps followUps;

    /**
     * Sets the damage of a standing building, clamped to [0,100]. At 100 the
     * building collapses and stops burning. Ruins are left untouched.
     *
     * @return the building as written
     */
    public BuildingInstance applyDamage(String buildingId, int damagePercent) {
        BuildingInstance building = store.loadBuilding(buildingId)
                .orElseThrow(() -> new NotFoundException("Building", buildingId));
        if (building.isCollapsed()) {
            log.debug("Ignoring damage to collapsed building {}", buildingId);
            return building;
        }

        int damage = Math.max(0, Math.min(COLLAPSE_DAMAGE, damagePercent));
        boolean collapsed = damage >= COLLAPSE_DAMAGE;
        boolean onFire = !collapsed && building.isOnFire();
        if (damage == building.getDamagePercent() && !collapsed) {
            return building;
        }

        Tile tile = store.loadTile(building.getTileId())
                .orElseThrow(() -> new InternalException("Building " + buildingId + " sits on a missing tile"));
        store.batchWrite(List.of(new RowMutation.SetCondition(buildingId, damage, onFire, collapsed)));
        if (collapsed) {
            log.info("Building {} at {} collapsed", buildingId, tile.getCoord());
        } else {
            log.debug("Building {} damage {} -> {}", buildingId, building.getDamagePercent(), damage);
        }

        followUps.markDirty(tile.getMapId(), tile.getCoord());
        return building.toBuilder().damagePercent(damage).onFire(onFire).collapsed(collapsed).build();
    }
}
