package dev.reviewgate.domain.workflow;

/**
 * Result of {@link AuthorizationGuard#authorize}. A denial names which of the two
 * independent checks failed.
 */
public record AuthorizationDecision(Outcome outcome, String reason) {

    public enum Outcome {
        ALLOWED, IDENTITY_NOT_IN_ROLE, STATE_NOT_PERMITTED
    }

    private static final AuthorizationDecision ALLOWED = new AuthorizationDecision(Outcome.ALLOWED, null);

    public static AuthorizationDecision allowed() {
        return ALLOWED;
    }

    public static AuthorizationDecision denied(Outcome outcome, String reason) {
        if (outcome == Outcome.ALLOWED) throw new IllegalArgumentException("denial needs a failing outcome");
        return new AuthorizationDecision(outcome, reason);
    }

    public boolean isAllowed() {
        return outcome == Outcome.ALLOWED;
    }
}
