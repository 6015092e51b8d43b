package com.notropolis.economy.grid;

import static org.assertj.core.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.notropolis.economy.model.BuildingInstance;
import com.notropolis.economy.model.GridCoord;
import com.notropolis.economy.model.TerrainType;
import com.notropolis.economy.model.Tile;
import com.notropolis.economy.support.TestWorld;

class GridIndexTest {

    @Test
    void testWindowHasTwentyFourCellsWithoutCenter() {
        List<GridCoord> window = GridIndex.window(GridCoord.of(5, 5), 2);

        assertThat(window).hasSize(24);
        assertThat(window).doesNotContain(GridCoord.of(5, 5));
        assertThat(window).allSatisfy(c -> assertThat(c.distanceTo(GridCoord.of(5, 5))).isBetween(1, 2));
        assertThat(window.get(0)).isEqualTo(GridCoord.of(3, 3));
        assertThat(window.get(23)).isEqualTo(GridCoord.of(7, 7));
    }

    @Test
    void testLooksUpTilesAndStandingBuildingsByCoordinate() {
        TestWorld world = TestWorld.grid(
                "R.W",
                "...",
                "..T")
                .company("c1", 0)
                .building("b1", 1, 1, "shop", "c1")
                .building(BuildingInstance.builder().id("ruin").tileId(TestWorld.tileId(2, 1)).mapId(TestWorld.MAP_ID)
                        .buildingTypeId("shop").companyId("c1").collapsed(true).build());

        GridIndex grid = GridIndex.build(world.store().loadTiles(TestWorld.MAP_ID),
                world.store().loadBuildings(TestWorld.MAP_ID, false));

        assertThat(grid.tileCount()).isEqualTo(9);
        assertThat(grid.buildingCount()).isEqualTo(1);
        assertThat(grid.tileAt(GridCoord.of(2, 0))).map(Tile::getTerrain).contains(TerrainType.WATER);
        assertThat(grid.tileAt(GridCoord.of(3, 0))).isEmpty();
        assertThat(grid.buildingAt(GridCoord.of(1, 1))).map(BuildingInstance::getId).contains("b1");
        assertThat(grid.buildingAt(GridCoord.of(2, 1))).isEmpty();
        assertThat(grid.coordOf(world.building("b1"))).contains(GridCoord.of(1, 1));
        assertThat(grid.neighborTiles(GridCoord.of(0, 0), 2)).hasSize(8);
        assertThat(grid.neighborBuildings(GridCoord.of(0, 0), 2)).extracting(BuildingInstance::getId)
                .containsExactly("b1");
    }

    @Test
    void testRejectsDuplicateCoordinates() {
        Tile a = Tile.builder().id("a").mapId("m").x(1).y(1).terrain(TerrainType.ROAD).build();
        Tile b = Tile.builder().id("b").mapId("m").x(1).y(1).terrain(TerrainType.WATER).build();

        assertThatThrownBy(() -> GridIndex.build(List.of(a, b), List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("(1,1)");
    }
}
