package com.nosota.mloan.service;

import com.nosota.mloan.api.model.LoanStatus;
import com.nosota.mloan.error.ErrorCode;
import com.nosota.mloan.error.InvalidStateException;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * State machine for validating LoanStatus transitions of loan records.
 *
 * <p>State diagram:
 * <pre>
 *            PENDING
 *            |     |
 *        ACTIVE   REJECTED
 *        |    |
 *    REPAID  DEFAULTED
 * </pre>
 *
 * <p>REPAID, REJECTED and DEFAULTED are final. Status never moves backward and a
 * status never transitions to itself.
 */
@Component
public class LoanStatusStateMachine {

    private static final Map<LoanStatus, Set<LoanStatus>> ALLOWED_TRANSITIONS = Map.of(
            LoanStatus.PENDING, EnumSet.of(LoanStatus.ACTIVE, LoanStatus.REJECTED),
            LoanStatus.ACTIVE, EnumSet.of(LoanStatus.REPAID, LoanStatus.DEFAULTED)
    );

    public boolean isTransitionAllowed(LoanStatus fromStatus, LoanStatus toStatus) {
        if (fromStatus == null || toStatus == null) {
            return false;
        }
        Set<LoanStatus> allowedTargets = ALLOWED_TRANSITIONS.get(fromStatus);
        return allowedTargets != null && allowedTargets.contains(toStatus);
    }

    /**
     * Validates a status transition.
     *
     * @param fromStatus Current status
     * @param toStatus   Target status
     * @throws InvalidStateException if the transition is not allowed
     */
    public void validateTransition(LoanStatus fromStatus, LoanStatus toStatus) throws InvalidStateException {
        if (!isTransitionAllowed(fromStatus, toStatus)) {
            throw new InvalidStateException(ErrorCode.INVALID_STATUS,
                    String.format("Invalid loan status transition: %s → %s. Allowed transitions from %s: %s",
                            fromStatus, toStatus, fromStatus, getAllowedTransitions(fromStatus)));
        }
    }

    public boolean isFinalState(LoanStatus status) {
        return status != null && status.isTerminal();
    }

    public Set<LoanStatus> getAllowedTransitions(LoanStatus fromStatus) {
        return ALLOWED_TRANSITIONS.getOrDefault(fromStatus, Set.of());
    }
}
