package com.notropolis.economy.model;

import java.time.Instant;
import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Append-only audit record of one mutating action.
 */
@Value
@Builder
@Jacksonized
public class TransactionLogEntry {

    @NonNull
    String id;

    @NonNull
    String companyId;

    String mapId;

    @NonNull
    ActionKind kind;

    String targetTileId;
    String targetBuildingId;
    String targetCompanyId;

    long amount;

    @Singular("detail")
    Map<String, Object> details;

    @NonNull
    Instant createdAt;
}
