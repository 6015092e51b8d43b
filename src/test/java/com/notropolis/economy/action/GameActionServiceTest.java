package com.notropolis.economy.action;

import static org.assertj.core.api.Assertions.*;

import java.util.function.Consumer;
import java.util.stream.Stream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import com.notropolis.economy.EconomyEngine;
import com.notropolis.economy.config.EngineConfig;
import com.notropolis.economy.error.ConflictException;
import com.notropolis.economy.error.NotFoundException;
import com.notropolis.economy.error.PreconditionException;
import com.notropolis.economy.error.PreconditionException.Reason;
import com.notropolis.economy.error.ValidationException;
import com.notropolis.economy.model.ActionKind;
import com.notropolis.economy.model.BuildingInstance;
import com.notropolis.economy.model.Company;
import com.notropolis.economy.model.LocationTier;
import com.notropolis.economy.model.ProfitModifier;
import com.notropolis.economy.model.TransactionLogEntry;
import com.notropolis.economy.store.WorldSnapshot;
import com.notropolis.economy.support.InterceptingGameStore;
import com.notropolis.economy.support.SequentialIdGenerator;
import com.notropolis.economy.support.TestWorld;

/**
 * Tests for company-initiated map actions run through the engine.
 */
class GameActionServiceTest {

    private TestWorld world;
    private EconomyEngine engine;

    @BeforeEach
    void setUp() {
        world = TestWorld.grid(
                "RRR..",
                ".....",
                "..W..",
                "...T.",
                ".....")
                .company("c1", 10_000)
                .company("c2", 10_000);
        engine = world.engine();
    }

    private static Reason reasonOf(Throwable t) {
        return ((PreconditionException) t).getReason();
    }

    static Stream<Arguments> gatedActions() {
        return Stream.of(
                Arguments.of("buyLand", (Consumer<EconomyEngine>) e -> e.buyLand("jailed", 4, 3)),
                Arguments.of("build", (Consumer<EconomyEngine>) e -> e.build("jailed", TestWorld.tileId(4, 4),
                        "market_stall")),
                Arguments.of("build unknown type", (Consumer<EconomyEngine>) e -> e.build("jailed",
                        TestWorld.tileId(4, 4), "no_such_type")),
                Arguments.of("demolish", (Consumer<EconomyEngine>) e -> e.demolish("jailed", "ruin")),
                Arguments.of("listForSale", (Consumer<EconomyEngine>) e -> e.listForSale("jailed", "stall", 900)),
                Arguments.of("cancelListing", (Consumer<EconomyEngine>) e -> e.cancelListing("jailed", "listed")),
                Arguments.of("buyProperty", (Consumer<EconomyEngine>) e -> e.buyProperty("jailed", "forSale")));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("gatedActions")
    void testImprisonedCompanyIsRefusedBeforeAnyOtherCheck(String name, Consumer<EconomyEngine> action) {
        world.company(Company.builder().id("jailed").name("jailed").currentMapId(TestWorld.MAP_ID)
                .cash(100_000).imprisoned(true).prisonFine(5_000).build())
                .owns("jailed", 4, 4)
                .building("stall", 1, 1, "market_stall", "jailed")
                .building(BuildingInstance.builder().id("listed").tileId(TestWorld.tileId(0, 1))
                        .mapId(TestWorld.MAP_ID).buildingTypeId("shop").companyId("jailed")
                        .forSale(true).salePrice(4_000L).build())
                .building(BuildingInstance.builder().id("ruin").tileId(TestWorld.tileId(1, 3))
                        .mapId(TestWorld.MAP_ID).buildingTypeId("shop").companyId("jailed")
                        .collapsed(true).damagePercent(100).build())
                .building(BuildingInstance.builder().id("forSale").tileId(TestWorld.tileId(3, 1))
                        .mapId(TestWorld.MAP_ID).buildingTypeId("shop").companyId("c2")
                        .forSale(true).salePrice(4_000L).build());
        WorldSnapshot before = world.store().toSnapshot();

        assertThatThrownBy(() -> action.accept(engine))
                .isInstanceOfSatisfying(PreconditionException.class,
                        e -> assertThat(e.getReason()).isEqualTo(Reason.IMPRISONED));

        assertThat(world.store().toSnapshot()).isEqualTo(before);
        assertThat(world.store().loadLog("jailed")).isEmpty();
        assertThat(world.store().loadLog("c2")).isEmpty();
    }

    @Nested
    class BuyLand {

        @Test
        void testBuyOpenLandInTown() {
            BuyLandResult result = engine.buyLand("c1", 1, 1);

            assertThat(result.getCost()).isEqualTo(500);
            assertThat(result.getRemainingCash()).isEqualTo(9_500);
            assertThat(result.getTileId()).isEqualTo(TestWorld.tileId(1, 1));
            assertThat(world.tile(1, 1).getOwnerCompanyId()).isEqualTo("c1");
            assertThat(world.tile(1, 1).getPurchasedAt()).isEqualTo(TestWorld.NOW);

            Company c1 = world.company("c1");
            assertThat(c1.getTotalActions()).isEqualTo(1);
            assertThat(c1.getTicksSinceAction()).isZero();
            assertThat(world.store().loadLog("c1"))
                    .extracting(TransactionLogEntry::getKind, TransactionLogEntry::getAmount)
                    .containsExactly(tuple(ActionKind.BUY_LAND, 500L));
        }

        @Test
        void testPriceFollowsTerrainAndTier() {
            assertThat(engine.buyLand("c1", 3, 3).getCost()).isEqualTo(600);

            TestWorld city = TestWorld.grid(LocationTier.CITY, "..").company("c1", 10_000);
            assertThat(city.engine().buyLand("c1", 0, 0).getCost()).isEqualTo(2_500);
        }

        @Test
        void testWaterAndRoadCannotBeBought() {
            assertThatThrownBy(() -> engine.buyLand("c1", 2, 2)).isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> engine.buyLand("c1", 0, 0)).isInstanceOf(ValidationException.class);
            assertThat(world.company("c1").getCash()).isEqualTo(10_000);
        }

        @Test
        void testTileOwnedByAnotherCompanyIsConflict() {
            world.owns("c2", 4, 4);

            assertThatThrownBy(() -> engine.buyLand("c1", 4, 4)).isInstanceOf(ConflictException.class);
            assertThat(world.tile(4, 4).getOwnerCompanyId()).isEqualTo("c2");
        }

        @Test
        void testBuyingOwnTileIsRejected() {
            engine.buyLand("c1", 1, 1);

            assertThatThrownBy(() -> engine.buyLand("c1", 1, 1)).isInstanceOf(ValidationException.class);
            assertThat(world.company("c1").getCash()).isEqualTo(9_500);
        }

        @Test
        void testInsufficientFunds() {
            world.company("poor", 499);

            assertThatThrownBy(() -> engine.buyLand("poor", 1, 1))
                    .isInstanceOf(PreconditionException.class)
                    .satisfies(e -> assertThat(reasonOf(e)).isEqualTo(Reason.INSUFFICIENT_FUNDS));
            assertThat(world.tile(1, 1).isOwned()).isFalse();
        }

        @Test
        void testOutsideMapAndLobby() {
            assertThatThrownBy(() -> engine.buyLand("c1", 9, 9)).isInstanceOf(NotFoundException.class);

            world.company(Company.builder().id("lobby").name("lobby").cash(10_000).build());
            assertThatThrownBy(() -> engine.buyLand("lobby", 1, 1))
                    .satisfies(e -> assertThat(reasonOf(e)).isEqualTo(Reason.NO_MAP));
        }

        @Test
        void testImprisonedCompanyIsStoppedFirst() {
            world.company(Company.builder().id("jailed").name("jailed").currentMapId(TestWorld.MAP_ID)
                    .cash(0).imprisoned(true).prisonFine(500).build());

            assertThatThrownBy(() -> engine.buyLand("jailed", 2, 2))
                    .isInstanceOf(PreconditionException.class)
                    .satisfies(e -> assertThat(reasonOf(e)).isEqualTo(Reason.IMPRISONED));
        }

        @Test
        void testPurchaseMarksNearbyBuildingsDirty() {
            world.building("b2", 3, 1, "shop", "c2");
            world.building("far", 4, 4, "market_stall", "c2");

            engine.buyLand("c1", 1, 1);

            assertThat(world.building("b2").isDirty()).isTrue();
            assertThat(world.building("far").isDirty()).isFalse();
        }
    }

    @Nested
    class Build {

        @Test
        void testBuildComputesProfitAndMarksNeighbors() {
            world.owns("c1", 1, 1).building("b2", 3, 1, "shop", "c2");

            BuildResult result = engine.build("c1", TestWorld.tileId(1, 1), "market_stall");

            assertThat(result.getProfit()).isEqualTo(118);
            assertThat(result.getCost()).isEqualTo(1_000);
            assertThat(result.getRemainingCash()).isEqualTo(9_000);
            assertThat(result.getBreakdown()).extracting(ProfitModifier::getSource)
                    .containsExactly("Adjacent water (1)", "Adjacent road (3)", "Adjacent trees (1)");

            BuildingInstance built = world.building(result.getBuildingId());
            assertThat(built.getCompanyId()).isEqualTo("c1");
            assertThat(built.getCachedProfit()).isEqualTo(118);
            assertThat(world.building("b2").isDirty()).isTrue();
            assertThat(world.store().loadLog("c1")).extracting(TransactionLogEntry::getKind)
                    .containsExactly(ActionKind.BUILD);
        }

        @Test
        void testPreviewMatchesBuildAndChangesNothing() {
            world.owns("c1", 1, 1).building("b2", 3, 1, "shop", "c2");

            ProfitPreview preview = engine.previewProfit(TestWorld.tileId(1, 1), "market_stall");

            assertThat(preview.getProfit()).isEqualTo(118);
            assertThat(world.building("b2").isDirty()).isFalse();
            assertThat(world.company("c1").getCash()).isEqualTo(10_000);
            assertThat(engine.build("c1", TestWorld.tileId(1, 1), "market_stall").getProfit())
                    .isEqualTo(preview.getProfit());
        }

        @Test
        void testUnknownTypeAndUnownedTile() {
            world.owns("c1", 1, 1);

            assertThatThrownBy(() -> engine.build("c1", TestWorld.tileId(1, 1), "space_station"))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> engine.build("c1", TestWorld.tileId(4, 4), "market_stall"))
                    .satisfies(e -> assertThat(reasonOf(e)).isEqualTo(Reason.NOT_OWNER));
            assertThatThrownBy(() -> engine.build("c1", "no-such-tile", "market_stall"))
                    .isInstanceOf(NotFoundException.class);
        }

        @Test
        void testOccupiedTileIsConflict() {
            world.building("b1", 1, 1, "market_stall", "c1");

            assertThatThrownBy(() -> engine.build("c1", TestWorld.tileId(1, 1), "shop"))
                    .isInstanceOf(ConflictException.class);
        }

        @Test
        void testLevelTooLow() {
            world.company("rich", 1_000_000).owns("rich", 1, 1);

            assertThatThrownBy(() -> engine.build("rich", TestWorld.tileId(1, 1), "burger_bar"))
                    .satisfies(e -> assertThat(reasonOf(e)).isEqualTo(Reason.LEVEL_TOO_LOW));
        }

        @Test
        void testLicenseCapCountsEveryRowOnTheMap() {
            world.company(Company.builder().id("mogul").name("mogul").currentMapId(TestWorld.MAP_ID)
                    .cash(1_000_000).level(3).build());
            world.building("r1", 3, 0, "restaurant", "c2")
                    .building("r2", 4, 0, "restaurant", "c2")
                    .building("r3", 0, 1, "restaurant", "c2")
                    .building("r4", 0, 2, "restaurant", "c2")
                    .building(BuildingInstance.builder().id("r5").tileId(TestWorld.tileId(0, 3))
                            .mapId(TestWorld.MAP_ID).buildingTypeId("restaurant").companyId("c2")
                            .collapsed(true).damagePercent(100).build())
                    .owns("mogul", 4, 4);

            assertThatThrownBy(() -> engine.build("mogul", TestWorld.tileId(4, 4), "restaurant"))
                    .satisfies(e -> assertThat(reasonOf(e)).isEqualTo(Reason.LICENSE_CAP_REACHED));
            assertThat(world.company("mogul").getCash()).isEqualTo(1_000_000);
        }

        @Test
        void testLicenseTakenBetweenCheckAndCommitIsConflict() {
            world.company(Company.builder().id("mogul").name("mogul").currentMapId(TestWorld.MAP_ID)
                    .cash(1_000_000).level(3).build());
            world.building("r1", 3, 0, "restaurant", "c2")
                    .building("r2", 4, 0, "restaurant", "c2")
                    .building("r3", 0, 1, "restaurant", "c2")
                    .building("r4", 0, 2, "restaurant", "c2")
                    .owns("mogul", 4, 4);
            InterceptingGameStore store = new InterceptingGameStore(world.store())
                    .onLoadTiles(() -> world.building("r5", 0, 3, "restaurant", "c2"));
            EconomyEngine racing = new EconomyEngine(store, EngineConfig.defaults(), TestWorld.catalog(),
                    new SequentialIdGenerator(), TestWorld.clock());

            assertThatThrownBy(() -> racing.build("mogul", TestWorld.tileId(4, 4), "restaurant"))
                    .isInstanceOf(ConflictException.class)
                    .hasMessageContaining("limit 5");

            assertThat(world.store().findBuildingOnTile(TestWorld.tileId(4, 4))).isEmpty();
            assertThat(world.company("mogul").getCash()).isEqualTo(1_000_000);
            assertThat(world.company("mogul").getTotalActions()).isZero();
            assertThat(world.store().loadLog("mogul")).isEmpty();
        }

        @Test
        void testInsufficientFundsToBuild() {
            world.company("poor", 999).owns("poor", 1, 1);

            assertThatThrownBy(() -> engine.build("poor", TestWorld.tileId(1, 1), "market_stall"))
                    .satisfies(e -> assertThat(reasonOf(e)).isEqualTo(Reason.INSUFFICIENT_FUNDS));
            assertThat(world.store().findBuildingOnTile(TestWorld.tileId(1, 1))).isEmpty();
        }
    }

    @Nested
    class Demolish {

        @Test
        void testDemolishClearsRuinsAndKeepsTile() {
            world.building(BuildingInstance.builder().id("ruin").tileId(TestWorld.tileId(1, 1))
                    .mapId(TestWorld.MAP_ID).buildingTypeId("shop").companyId("c1")
                    .collapsed(true).damagePercent(100).build());

            ActionResult result = engine.demolish("c1", "ruin");

            assertThat(result.getAction()).isEqualTo(ActionKind.DEMOLISH);
            assertThat(result.getAmount()).isEqualTo(400);
            assertThat(result.getRemainingCash()).isEqualTo(9_600);
            assertThat(world.store().loadBuilding("ruin")).isEmpty();
            assertThat(world.tile(1, 1).getOwnerCompanyId()).isEqualTo("c1");
        }

        @Test
        void testStandingBuildingCannotBeDemolished() {
            world.building("b1", 1, 1, "shop", "c1");

            assertThatThrownBy(() -> engine.demolish("c1", "b1"))
                    .satisfies(e -> assertThat(reasonOf(e)).isEqualTo(Reason.INVALID_STATE));
            assertThatThrownBy(() -> engine.demolish("c2", "b1"))
                    .satisfies(e -> assertThat(reasonOf(e)).isEqualTo(Reason.NOT_OWNER));
        }
    }

    @Nested
    class Trading {

        @Test
        void testListingHasMinimumPrice() {
            world.building("b1", 1, 1, "shop", "c1");

            assertThatThrownBy(() -> engine.listForSale("c1", "b1", 3_199)).isInstanceOf(ValidationException.class);

            engine.listForSale("c1", "b1", 3_200);
            assertThat(world.building("b1").isForSale()).isTrue();
            assertThat(world.building("b1").getSalePrice()).isEqualTo(3_200L);

            assertThatThrownBy(() -> engine.listForSale("c1", "b1", 5_000))
                    .satisfies(e -> assertThat(reasonOf(e)).isEqualTo(Reason.INVALID_STATE));
        }

        @Test
        void testCancelListing() {
            world.building("b1", 1, 1, "shop", "c1");
            engine.listForSale("c1", "b1", 4_000);

            engine.cancelListing("c1", "b1");

            assertThat(world.building("b1").isForSale()).isFalse();
            assertThat(world.building("b1").getSalePrice()).isNull();
            assertThatThrownBy(() -> engine.cancelListing("c1", "b1"))
                    .satisfies(e -> assertThat(reasonOf(e)).isEqualTo(Reason.INVALID_STATE));
        }

        @Test
        void testBuyPropertyTransfersBuildingAndTile() {
            world.building("b2", 3, 1, "shop", "c2");
            engine.listForSale("c2", "b2", 5_000);

            ActionResult result = engine.buyProperty("c1", "b2");

            assertThat(result.getAmount()).isEqualTo(5_000);
            assertThat(result.getRemainingCash()).isEqualTo(5_000);
            assertThat(world.company("c2").getCash()).isEqualTo(15_000);

            BuildingInstance bought = world.building("b2");
            assertThat(bought.getCompanyId()).isEqualTo("c1");
            assertThat(bought.isForSale()).isFalse();
            assertThat(world.tile(3, 1).getOwnerCompanyId()).isEqualTo("c1");

            assertThat(world.store().loadLog("c1")).extracting(TransactionLogEntry::getKind)
                    .containsExactly(ActionKind.BUY_PROPERTY);
            assertThat(world.store().loadLog("c2")).extracting(TransactionLogEntry::getKind)
                    .containsExactly(ActionKind.LIST_FOR_SALE, ActionKind.SELL_PROPERTY);
        }

        @Test
        void testBuyPropertyPreconditions() {
            world.building("b2", 3, 1, "shop", "c2");

            assertThatThrownBy(() -> engine.buyProperty("c1", "b2"))
                    .satisfies(e -> assertThat(reasonOf(e)).isEqualTo(Reason.INVALID_STATE));
            assertThatThrownBy(() -> engine.buyProperty("c2", "b2")).isInstanceOf(ValidationException.class);

            engine.listForSale("c2", "b2", 20_000);
            assertThatThrownBy(() -> engine.buyProperty("c1", "b2"))
                    .satisfies(e -> assertThat(reasonOf(e)).isEqualTo(Reason.INSUFFICIENT_FUNDS));
            assertThat(world.building("b2").getCompanyId()).isEqualTo("c2");
        }
    }

    @Nested
    class Damage {

        @Test
        void testDamageClampsAndCollapses() {
            world.building("b1", 1, 1, "shop", "c1").building("b2", 3, 1, "shop", "c2");

            assertThat(engine.applyDamage("b1", 40).getDamagePercent()).isEqualTo(40);
            assertThat(world.building("b2").isDirty()).isTrue();

            BuildingInstance ruin = engine.applyDamage("b1", 250);
            assertThat(ruin.isCollapsed()).isTrue();
            assertThat(ruin.getDamagePercent()).isEqualTo(100);

            assertThat(engine.applyDamage("b1", 10).isCollapsed()).isTrue();
            assertThat(world.building("b1").getDamagePercent()).isEqualTo(100);
        }
    }
}
