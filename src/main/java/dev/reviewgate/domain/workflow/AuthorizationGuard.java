package dev.reviewgate.domain.workflow;

import dev.reviewgate.domain.enums.PartyRole;
import dev.reviewgate.domain.enums.PullRequestState;
import dev.reviewgate.domain.valueobject.Parties;
import dev.reviewgate.exception.AuthorizationDeniedException;
import dev.reviewgate.exception.StateGuardViolationException;

/**
 * Decides whether a caller may run an operation on a pull request.
 *
 * <p>Pure function of (identity, frozen parties, operation, state). The role check
 * runs first; the state guard only matters once the caller holds a permitted role.
 */
public final class AuthorizationGuard {

    private AuthorizationGuard() {
    }

    public static AuthorizationDecision authorize(String caller, PullRequestOperation operation,
                                                  Parties parties, PullRequestState state) {
        boolean inRole = false;
        for (PartyRole role : operation.getRequiredRoles()) {
            if (parties.isMember(caller, role)) {
                inRole = true;
                break;
            }
        }
        if (!inRole) {
            return AuthorizationDecision.denied(AuthorizationDecision.Outcome.IDENTITY_NOT_IN_ROLE,
                    "'%s' is not authorized for %s (requires %s)"
                            .formatted(caller, operation.getOperationName(), operation.getRequiredRoles()));
        }
        if (!operation.permitsState(state)) {
            return AuthorizationDecision.denied(AuthorizationDecision.Outcome.STATE_NOT_PERMITTED,
                    "%s is not permitted in state %s (allowed: %s)"
                            .formatted(operation.getOperationName(), state, operation.getSourceStates()));
        }
        return AuthorizationDecision.allowed();
    }

    /**
     * Same as {@link #authorize} but raises the matching failure for a denial.
     */
    public static void check(String caller, PullRequestOperation operation,
                             Parties parties, PullRequestState state) {
        AuthorizationDecision decision = authorize(caller, operation, parties, state);
        switch (decision.outcome()) {
            case ALLOWED -> {
            }
            case IDENTITY_NOT_IN_ROLE -> throw new AuthorizationDeniedException(caller, operation, decision.reason());
            case STATE_NOT_PERMITTED -> throw new StateGuardViolationException(operation, state, decision.reason());
        }
    }
}
