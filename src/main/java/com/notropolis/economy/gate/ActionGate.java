package com.notropolis.economy.gate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.notropolis.economy.error.PreconditionException;
import com.notropolis.economy.error.PreconditionException.Reason;
import com.notropolis.economy.model.ActionKind;
import com.notropolis.economy.model.Company;
import com.notropolis.economy.model.PrisonStatus;

/**
 * Prison state machine guarding company-initiated actions.
 * <pre>
 *   FREE --imprison(fine)--&gt; IMPRISONED --payFine--&gt; FREE
 * </pre>
 * While imprisoned every gated action is refused. Paying the fine is the one
 * action allowed then, and only then. Passive effects and reads never pass
 * through here.
 */
public class ActionGate {

    private static final Logger log = LoggerFactory.getLogger(ActionGate.class);

    /**
     * Must be the first check of every action handler.
     *
     * @throws PreconditionException with reason {@link Reason#IMPRISONED} or {@link Reason#NOT_IMPRISONED}
     */
    public void check(Company company, ActionKind action) {
        PrisonStatus status = company.getPrisonStatus();

        if (action == ActionKind.PAY_FINE) {
            if (status != PrisonStatus.IMPRISONED) {
                throw new PreconditionException(Reason.NOT_IMPRISONED,
                        "Company " + company.getId() + " is not in prison; there is no fine to pay");
            }
            return;
        }

        if (action.isGated() && status == PrisonStatus.IMPRISONED) {
            log.debug("Refused {} for imprisoned company {}", action, company.getId());
            throw new PreconditionException(Reason.IMPRISONED,
                    "Company " + company.getId() + " is in prison and must pay a fine of "
                            + company.getPrisonFine() + " before acting");
        }
    }

    public boolean permits(Company company, ActionKind action) {
        if (action == ActionKind.PAY_FINE) {
            return company.getPrisonStatus() == PrisonStatus.IMPRISONED;
        }
        return !action.isGated() || company.getPrisonStatus() == PrisonStatus.FREE;
    }
}
