package com.notropolis.economy.model;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnore;

import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

/**
 * One map cell. Rows handed out by a store are copies; mutate through the store.
 */
@Data
@Builder(toBuilder = true)
@Jacksonized
public class Tile {

    private String id;
    private String mapId;
    private int x;
    private int y;
    private TerrainType terrain;
    private SpecialStructure specialStructure;
    private String ownerCompanyId;
    private Instant purchasedAt;

    @JsonIgnore
    public GridCoord getCoord() {
        return GridCoord.of(x, y);
    }

    /**
     * Whether this tile may ever carry an owner.
     */
    @JsonIgnore
    public boolean isOwnable() {
        return terrain != null && terrain.isOwnable() && specialStructure == null;
    }

    @JsonIgnore
    public boolean isOwned() {
        return ownerCompanyId != null;
    }
}
