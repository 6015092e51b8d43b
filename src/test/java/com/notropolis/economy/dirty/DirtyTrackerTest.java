package com.notropolis.economy.dirty;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.notropolis.economy.error.NotFoundException;
import com.notropolis.economy.model.BuildingInstance;
import com.notropolis.economy.support.TestWorld;

/**
 * Dirty coverage: everything standing within two tiles of an event, nothing beyond.
 */
class DirtyTrackerTest {

    private TestWorld world;
    private DirtyTracker tracker;

    @BeforeEach
    void setUp() {
        world = TestWorld.grid(
                ".......",
                ".......",
                ".......",
                ".......",
                ".......",
                ".......",
                ".......")
                .company("c1", 0)
                .building("near", 2, 2, "shop", "c1")
                .building("edge", 5, 5, "shop", "c1")
                .building("far", 6, 6, "shop", "c1")
                .building("farX", 6, 3, "shop", "c1")
                .building(BuildingInstance.builder().id("ruin").tileId(TestWorld.tileId(4, 4)).mapId(TestWorld.MAP_ID)
                        .buildingTypeId("shop").companyId("c1").collapsed(true).build());
        tracker = new DirtyTracker(world.store(), 2);
    }

    @Test
    void testMarksEveryStandingBuildingWithinRadius() {
        int marked = tracker.markDirty(TestWorld.MAP_ID, 3, 3);

        assertThat(marked).isEqualTo(2);
        assertThat(world.building("near").isDirty()).isTrue();
        assertThat(world.building("edge").isDirty()).isTrue();
    }

    @Test
    void testLeavesBuildingsOutsideRadiusAndRuinsClean() {
        tracker.markDirty(TestWorld.MAP_ID, 3, 3);

        assertThat(world.building("far").isDirty()).isFalse();
        assertThat(world.building("farX").isDirty()).isFalse();
        assertThat(world.building("ruin").isDirty()).isFalse();
    }

    @Test
    void testMarkingTwiceKeepsBuildingsDirty() {
        tracker.markDirty(TestWorld.MAP_ID, 2, 2);
        long versionAfterFirst = world.building("near").getProfitCache().getDirtyVersion();
        tracker.markDirty(TestWorld.MAP_ID, 2, 2);

        assertThat(world.building("near").isDirty()).isTrue();
        assertThat(world.building("near").getProfitCache().getDirtyVersion()).isGreaterThan(versionAfterFirst);
        assertThat(world.building("near").getCachedProfit()).isZero();
    }

    @Test
    void testEventWithNothingAroundWritesNothing() {
        TestWorld empty = TestWorld.grid("...", "...", "...");

        assertThat(new DirtyTracker(empty.store(), 2).markDirty(TestWorld.MAP_ID, 1, 1)).isZero();
    }

    @Test
    void testUnknownMapIsNotFound() {
        assertThatThrownBy(() -> tracker.markDirty("nowhere", 0, 0)).isInstanceOf(NotFoundException.class);
    }
}
