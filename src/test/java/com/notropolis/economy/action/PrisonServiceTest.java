package com.notropolis.economy.action;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.notropolis.economy.EconomyEngine;
import com.notropolis.economy.error.PreconditionException;
import com.notropolis.economy.error.PreconditionException.Reason;
import com.notropolis.economy.error.ValidationException;
import com.notropolis.economy.model.ActionKind;
import com.notropolis.economy.model.Company;
import com.notropolis.economy.model.TransactionLogEntry;
import com.notropolis.economy.support.TestWorld;

/**
 * Tests for going to prison and paying the way out.
 */
class PrisonServiceTest {

    private TestWorld world;
    private EconomyEngine engine;

    @BeforeEach
    void setUp() {
        world = TestWorld.grid(
                "...",
                "...");
        engine = world.engine();
    }

    @Test
    void testFineAboveCashKeepsCompanyImprisoned() {
        world.company(Company.builder().id("c1").name("c1").currentMapId(TestWorld.MAP_ID)
                .cash(1500).imprisoned(true).prisonFine(2000).build());

        assertThatThrownBy(() -> engine.payFine("c1"))
                .isInstanceOfSatisfying(PreconditionException.class,
                        e -> assertThat(e.getReason()).isEqualTo(Reason.INSUFFICIENT_FUNDS));

        Company after = world.company("c1");
        assertThat(after.isImprisoned()).isTrue();
        assertThat(after.getPrisonFine()).isEqualTo(2000);
        assertThat(after.getCash()).isEqualTo(1500);
        assertThat(world.store().loadLog("c1")).isEmpty();
    }

    @Test
    void testPayingTheFineReleasesAndCountsAsAction() {
        world.company(Company.builder().id("c1").name("c1").currentMapId(TestWorld.MAP_ID)
                .cash(2000).totalActions(3).ticksSinceAction(4).imprisoned(true).prisonFine(2000).build());

        PayFineResult result = engine.payFine("c1");

        assertThat(result.getFinePaid()).isEqualTo(2000);
        assertThat(result.getRemainingCash()).isZero();
        assertThat(result.getLevelUpIfAny()).isEmpty();

        Company after = world.company("c1");
        assertThat(after.isImprisoned()).isFalse();
        assertThat(after.getPrisonFine()).isZero();
        assertThat(after.getTotalActions()).isEqualTo(4);
        assertThat(after.getTicksSinceAction()).isZero();
        assertThat(after.getLastActionAt()).isEqualTo(TestWorld.NOW);
        assertThat(world.store().loadLog("c1"))
                .extracting(TransactionLogEntry::getKind, TransactionLogEntry::getAmount)
                .containsExactly(tuple(ActionKind.PAY_FINE, 2000L));
    }

    @Test
    void testPayFineWhileFreeIsRejected() {
        world.company("c1", 5000);

        assertThatThrownBy(() -> engine.payFine("c1"))
                .isInstanceOfSatisfying(PreconditionException.class,
                        e -> assertThat(e.getReason()).isEqualTo(Reason.NOT_IMPRISONED));
        assertThat(world.company("c1").getCash()).isEqualTo(5000);
    }

    @Test
    void testImprisonBlocksActionsUntilFinePaid() {
        world.company("c1", 5000);

        engine.imprison("c1", 1200);

        assertThat(world.company("c1").isImprisoned()).isTrue();
        assertThat(world.store().loadLog("c1"))
                .extracting(TransactionLogEntry::getKind)
                .containsExactly(ActionKind.CAUGHT_BY_POLICE);
        assertThatThrownBy(() -> engine.buyLand("c1", 0, 0))
                .isInstanceOfSatisfying(PreconditionException.class,
                        e -> assertThat(e.getReason()).isEqualTo(Reason.IMPRISONED));

        engine.payFine("c1");

        assertThat(world.company("c1").getCash()).isEqualTo(3800);
        assertThatCode(() -> engine.buyLand("c1", 0, 0)).doesNotThrowAnyException();
    }

    @Test
    void testImprisonValidatesFineAndState() {
        world.company("c1", 5000);

        assertThatThrownBy(() -> engine.imprison("c1", 0)).isInstanceOf(ValidationException.class);

        engine.imprison("c1", 100);
        assertThatThrownBy(() -> engine.imprison("c1", 100))
                .isInstanceOfSatisfying(PreconditionException.class,
                        e -> assertThat(e.getReason()).isEqualTo(Reason.INVALID_STATE));
        assertThat(world.company("c1").getPrisonFine()).isEqualTo(100);
    }
}
