package com.notropolis.economy.action;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.notropolis.economy.error.NotFoundException;
import com.notropolis.economy.error.PreconditionException;
import com.notropolis.economy.error.PreconditionException.Reason;
import com.notropolis.economy.error.ValidationException;
import com.notropolis.economy.gate.ActionGate;
import com.notropolis.economy.model.ActionKind;
import com.notropolis.economy.model.Company;
import com.notropolis.economy.model.TransactionLogEntry;
import com.notropolis.economy.store.GameStore;
import com.notropolis.economy.store.IdGenerator;
import com.notropolis.economy.store.RowMutation;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Drives the prison transitions of the action gate.
 */
@RequiredArgsConstructor
public class PrisonService {

    private static final Logger log = LoggerFactory.getLogger(PrisonService.class);

    @NonNull
    private final GameStore store;
    @NonNull
    private final ActionGate gate;
    @NonNull
    private final ActionFollowUps followUps;
    @NonNull
    private final IdGenerator ids;
    @NonNull
    private final Clock clock;

    /**
     * FREE to IMPRISONED. Called by enforcement when a company is caught; not a counted action.
     */
    public void imprison(String companyId, long fine) {
        if (fine <= 0) {
            throw new ValidationException("Fine must be positive. Got: " + fine);
        }
        Company company = requireCompany(companyId);
        if (company.isImprisoned()) {
            throw new PreconditionException(Reason.INVALID_STATE, "Company " + companyId + " is already in prison");
        }

        TransactionLogEntry entry = TransactionLogEntry.builder()
                .id(ids.nextId())
                .companyId(companyId)
                .mapId(company.getCurrentMapId())
                .kind(ActionKind.CAUGHT_BY_POLICE)
                .amount(fine)
                .createdAt(clock.instant())
                .build();
        store.batchWrite(List.of(
                new RowMutation.SetPrison(companyId, true, fine),
                new RowMutation.AppendLog(entry)));
        log.info("Company {} imprisoned with a fine of {}", companyId, fine);
    }

    /**
     * IMPRISONED to FREE. Paying counts as an action like any other.
     *
     * @throws PreconditionException NOT_IMPRISONED when free, INSUFFICIENT_FUNDS when cash is below the fine;
     *                               the company stays imprisoned in the latter case
     */
    public PayFineResult payFine(String companyId) {
        Company company = requireCompany(companyId);
        gate.check(company, ActionKind.PAY_FINE);

        long fine = company.getPrisonFine();
        if (company.getCash() < fine) {
            throw new PreconditionException(Reason.INSUFFICIENT_FUNDS,
                    "Insufficient funds to pay fine: need " + fine + ", have " + company.getCash());
        }

        Instant now = clock.instant();
        TransactionLogEntry entry = TransactionLogEntry.builder()
                .id(ids.nextId())
                .companyId(companyId)
                .mapId(company.getCurrentMapId())
                .kind(ActionKind.PAY_FINE)
                .amount(fine)
                .createdAt(now)
                .build();
        store.batchWrite(List.of(
                new RowMutation.SetPrison(companyId, false, 0L),
                new RowMutation.AdjustCash(companyId, -fine, true),
                new RowMutation.RecordAction(companyId, now),
                new RowMutation.AppendLog(entry)));
        log.info("Company {} paid a fine of {} and was released", companyId, fine);

        return PayFineResult.builder()
                .finePaid(fine)
                .remainingCash(requireCompany(companyId).getCash())
                .levelUp(followUps.checkLevel(companyId).orElse(null))
                .build();
    }

    private Company requireCompany(String companyId) {
        return store.loadCompany(companyId).orElseThrow(() -> new NotFoundException("Company", companyId));
    }
}
