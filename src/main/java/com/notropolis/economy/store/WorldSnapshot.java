package com.notropolis.economy.store;

import java.util.List;

import com.notropolis.economy.model.BuildingInstance;
import com.notropolis.economy.model.Company;
import com.notropolis.economy.model.GameMap;
import com.notropolis.economy.model.Tile;
import com.notropolis.economy.model.TransactionLogEntry;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Serializable image of a whole world: every row of every table.
 */
@Value
@Builder
@Jacksonized
public class WorldSnapshot {

    @Singular
    List<GameMap> maps;

    @Singular
    List<Tile> tiles;

    @Singular
    List<Company> companies;

    @Singular
    List<BuildingInstance> buildings;

    @Singular
    List<TransactionLogEntry> transactions;
}
