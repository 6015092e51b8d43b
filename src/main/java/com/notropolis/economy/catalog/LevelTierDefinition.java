package com.notropolis.economy.catalog;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class LevelTierDefinition {
    private int level;
    private long cashRequired;
    private long actionsRequired;
    private List<String> actionUnlocks = new ArrayList<>();
}
