package com.notropolis.economy.model;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnore;

import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

/**
 * A player company. {@code level} is derived from cash and action totals and never decreases.
 */
@Data
@Builder(toBuilder = true)
@Jacksonized
public class Company {

    private String id;
    private String userId;
    private String name;

    /**
     * Null while the company sits in the lobby.
     */
    private String currentMapId;

    private long cash;
    private long offshore;

    @Builder.Default
    private int level = 1;

    private long totalActions;

    private boolean imprisoned;
    private long prisonFine;

    private Instant lastActionAt;
    private int ticksSinceAction;

    @JsonIgnore
    public PrisonStatus getPrisonStatus() {
        return imprisoned ? PrisonStatus.IMPRISONED : PrisonStatus.FREE;
    }
}
