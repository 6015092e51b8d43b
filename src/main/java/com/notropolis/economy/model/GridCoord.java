package com.notropolis.economy.model;

import lombok.Value;

/**
 * Integer tile coordinate within one map.
 */
@Value(staticConstructor = "of")
public class GridCoord {
    int x;
    int y;

    public GridCoord offset(int dx, int dy) {
        return GridCoord.of(x + dx, y + dy);
    }

    /**
     * Chebyshev distance, the metric of the square adjacency window.
     */
    public int distanceTo(GridCoord other) {
        return Math.max(Math.abs(x - other.x), Math.abs(y - other.y));
    }

    @Override
    public String toString() {
        return "(" + x + "," + y + ")";
    }
}
