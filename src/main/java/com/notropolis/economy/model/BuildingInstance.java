package com.notropolis.economy.model;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnore;

import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

/**
 * A constructed building on exactly one tile. Collapsed buildings stay as rows
 * until demolished but never earn nor count as a neighbor.
 */
@Data
@Builder(toBuilder = true)
@Jacksonized
public class BuildingInstance {

    private String id;
    private String tileId;
    private String mapId;
    private String buildingTypeId;
    private String companyId;

    private int damagePercent;
    private boolean onFire;
    private boolean collapsed;

    private boolean forSale;
    private Long salePrice;

    @Builder.Default
    private ProfitCache profitCache = ProfitCache.builder().build();

    private Instant builtAt;

    @JsonIgnore
    public boolean isDirty() {
        return profitCache != null && profitCache.isDirty();
    }

    @JsonIgnore
    public long getCachedProfit() {
        return profitCache == null ? 0L : profitCache.getProfit();
    }
}
