package com.notropolis.economy.store;

import java.util.List;
import java.util.Optional;

import com.notropolis.economy.model.BuildingInstance;
import com.notropolis.economy.model.Company;
import com.notropolis.economy.model.GameMap;
import com.notropolis.economy.model.Tile;
import com.notropolis.economy.model.TransactionLogEntry;

/**
 * Relational store the economy core runs against.
 * <p>
 * Rows returned are detached copies. All changes go through {@link #batchWrite(List)},
 * which applies every mutation or none: a failed condition raises
 * {@code ConflictException}, a storage failure {@code InternalException}.
 */
public interface GameStore {

    Optional<GameMap> loadMap(String mapId);

    List<GameMap> loadMaps();

    List<Tile> loadTiles(String mapId);

    Optional<Tile> loadTile(String tileId);

    Optional<Tile> findTile(String mapId, int x, int y);

    /**
     * Buildings on a map, collapsed ones included.
     *
     * @param onlyDirty restrict to buildings whose cached profit is flagged stale
     */
    List<BuildingInstance> loadBuildings(String mapId, boolean onlyDirty);

    Optional<BuildingInstance> loadBuilding(String buildingId);

    Optional<BuildingInstance> findBuildingOnTile(String tileId);

    Optional<Company> loadCompany(String companyId);

    List<Company> loadCompaniesOnMap(String mapId);

    void batchWrite(List<RowMutation> mutations);

    void appendLog(TransactionLogEntry entry);

    List<TransactionLogEntry> loadLog(String companyId);
}
