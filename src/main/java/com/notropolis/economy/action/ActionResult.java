package com.notropolis.economy.action;

import java.util.List;

import com.notropolis.economy.model.ActionKind;
import com.notropolis.economy.progression.LevelUp;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Outcome of an action that only needs to report what it cost and what is left.
 */
@Value
@Builder
public class ActionResult {
    ActionKind action;
    String targetId;
    long amount;
    long remainingCash;

    @Singular
    List<LevelUp> levelUps;
}
