package com.notropolis.economy.action;

import java.util.List;

import com.notropolis.economy.model.ProfitModifier;

import lombok.Value;

@Value
public class ProfitPreview {
    String tileId;
    String buildingTypeId;
    long profit;
    List<ProfitModifier> breakdown;
}
