package com.notropolis.economy.model;

import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import lombok.Builder;

/**
 * One named line of a profit breakdown.
 */
@Value
@Builder
@Jacksonized
public class ProfitModifier {
    String source;
    double modifier;

    public static ProfitModifier of(String source, double modifier) {
        return new ProfitModifier(source, modifier);
    }
}
