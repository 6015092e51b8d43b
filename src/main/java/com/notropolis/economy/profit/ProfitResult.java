package com.notropolis.economy.profit;

import java.util.List;

import com.notropolis.economy.model.ProfitModifier;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Output of one profit calculation: the rounded profit, the ordered modifier
 * lines and their sum.
 */
@Value
@Builder
public class ProfitResult {
    long profit;

    @Singular("line")
    List<ProfitModifier> breakdown;

    double totalModifier;
}
