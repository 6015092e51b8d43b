package com.notropolis.economy.action;

import java.util.Optional;

import com.notropolis.economy.progression.LevelUp;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PayFineResult {
    long finePaid;
    long remainingCash;
    LevelUp levelUp;

    public Optional<LevelUp> getLevelUpIfAny() {
        return Optional.ofNullable(levelUp);
    }
}
