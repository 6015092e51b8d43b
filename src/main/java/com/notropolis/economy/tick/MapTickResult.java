package com.notropolis.economy.tick;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MapTickResult {
    String mapId;
    int buildingsRecalculated;
    int companiesUpdated;
    int idleCompaniesAdvanced;
    long grossProfit;
    long taxAmount;
    long netProfit;
    int levelUps;
}
