package dev.reviewgate.domain.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle: DRAFT → OPEN → REVIEW_REQUESTED → IN_REVIEW | CHANGES_REQUESTED → APPROVED → MERGED.
 * CLOSED is reachable from every non-final state and can be reopened to OPEN.
 */
public enum PullRequestState {
    DRAFT("draft"),
    OPEN("open"),
    REVIEW_REQUESTED("review_requested"),
    IN_REVIEW("in_review"),
    CHANGES_REQUESTED("changes_requested"),
    APPROVED("approved"),
    MERGED("merged"),
    CLOSED("closed");

    private final String identifier;

    PullRequestState(String identifier) {
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }

    public boolean isFinal() {
        return this == MERGED;
    }

    /** Targets reachable from this state; self-loops are listed where a review may leave the state as is. */
    public Set<PullRequestState> validTransitions() {
        return switch (this) {
            case DRAFT -> EnumSet.of(OPEN, CLOSED);
            case OPEN -> EnumSet.of(DRAFT, REVIEW_REQUESTED, CLOSED);
            case REVIEW_REQUESTED -> EnumSet.of(DRAFT, IN_REVIEW, CHANGES_REQUESTED, APPROVED, CLOSED);
            case IN_REVIEW -> EnumSet.of(IN_REVIEW, CHANGES_REQUESTED, APPROVED, CLOSED);
            case CHANGES_REQUESTED -> EnumSet.of(CHANGES_REQUESTED, IN_REVIEW, APPROVED, CLOSED);
            case APPROVED -> EnumSet.of(MERGED, CLOSED);
            case MERGED -> EnumSet.noneOf(PullRequestState.class);
            case CLOSED -> EnumSet.of(OPEN);
        };
    }

    public boolean canTransitionTo(PullRequestState target) {
        return validTransitions().contains(target);
    }

    @Override
    public String toString() {
        return identifier;
    }
}
