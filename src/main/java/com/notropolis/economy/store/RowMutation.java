package com.notropolis.economy.store;

import java.time.Instant;
import java.util.List;

import com.notropolis.economy.model.BuildingInstance;
import com.notropolis.economy.model.ProfitModifier;
import com.notropolis.economy.model.TransactionLogEntry;

import lombok.NonNull;
import lombok.Value;

/**
 * One row change inside a {@link GameStore#batchWrite(List)}. Conditional
 * mutations fail the whole batch when their guard no longer holds.
 */
public interface RowMutation {

    /**
     * Sets the owner of a tile, guarded on the current owner being {@code expectedOwnerId}.
     */
    @Value
    class ClaimTile implements RowMutation {
        @NonNull String tileId;
        String expectedOwnerId;
        String newOwnerId;
        Instant at;
    }

    /**
     * Inserts a building, guarded on its tile being empty.
     */
    @Value
    class InsertBuilding implements RowMutation {
        @NonNull BuildingInstance building;
    }

    /**
     * Fails the batch unless fewer than {@code limit} buildings of the type,
     * standing or collapsed, are on the map at this point of the batch.
     */
    @Value
    class RequireTypeCountBelow implements RowMutation {
        @NonNull String mapId;
        @NonNull String buildingTypeId;
        int limit;
    }

    @Value
    class DeleteBuilding implements RowMutation {
        @NonNull String buildingId;
    }

    /**
     * Moves a building to a new owner, guarded on the seller still owning it
     * and, when {@code requireListed}, on it still being for sale. Clears the listing.
     */
    @Value
    class TransferBuilding implements RowMutation {
        @NonNull String buildingId;
        @NonNull String expectedOwnerId;
        @NonNull String newOwnerId;
        boolean requireListed;
    }

    @Value
    class UpdateListing implements RowMutation {
        @NonNull String buildingId;
        @NonNull String expectedOwnerId;
        boolean forSale;
        Long price;
    }

    @Value
    class SetCondition implements RowMutation {
        @NonNull String buildingId;
        int damagePercent;
        boolean onFire;
        boolean collapsed;
    }

    @Value
    class MarkDirty implements RowMutation {
        @NonNull String buildingId;
    }

    /**
     * Stores a recomputed profit. The dirty flag is cleared only if no mark
     * happened since {@code snapshotVersion} was read.
     */
    @Value
    class CommitProfit implements RowMutation {
        @NonNull String buildingId;
        long profit;
        @NonNull List<ProfitModifier> breakdown;
        long snapshotVersion;
    }

    /**
     * Adds {@code delta} to a company's cash. With {@code requireCovered} the
     * batch fails if the balance would drop below zero.
     */
    @Value
    class AdjustCash implements RowMutation {
        @NonNull String companyId;
        long delta;
        boolean requireCovered;
    }

    /**
     * Counts one company-initiated action: increments the action counter,
     * stamps the last-action time and resets the idle tick counter.
     */
    @Value
    class RecordAction implements RowMutation {
        @NonNull String companyId;
        @NonNull Instant at;
    }

    @Value
    class AdvanceIdleTicks implements RowMutation {
        @NonNull String companyId;
    }

    /**
     * Changes prison state, guarded on the current state being {@code !imprisoned}.
     */
    @Value
    class SetPrison implements RowMutation {
        @NonNull String companyId;
        boolean imprisoned;
        long fine;
    }

    /**
     * Raises the stored level; never lowers it.
     */
    @Value
    class RaiseLevel implements RowMutation {
        @NonNull String companyId;
        int level;
    }

    @Value
    class AppendLog implements RowMutation {
        @NonNull TransactionLogEntry entry;
    }
}
