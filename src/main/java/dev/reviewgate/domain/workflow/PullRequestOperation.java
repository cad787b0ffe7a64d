package dev.reviewgate.domain.workflow;

import dev.reviewgate.domain.enums.PartyRole;
import dev.reviewgate.domain.enums.PullRequestState;

import java.util.EnumSet;
import java.util.Set;

import static dev.reviewgate.domain.enums.PartyRole.AUTHOR;
import static dev.reviewgate.domain.enums.PartyRole.MAINTAINER;
import static dev.reviewgate.domain.enums.PartyRole.REVIEWER;
import static dev.reviewgate.domain.enums.PullRequestState.APPROVED;
import static dev.reviewgate.domain.enums.PullRequestState.CHANGES_REQUESTED;
import static dev.reviewgate.domain.enums.PullRequestState.CLOSED;
import static dev.reviewgate.domain.enums.PullRequestState.DRAFT;
import static dev.reviewgate.domain.enums.PullRequestState.IN_REVIEW;
import static dev.reviewgate.domain.enums.PullRequestState.OPEN;
import static dev.reviewgate.domain.enums.PullRequestState.REVIEW_REQUESTED;

/**
 * Operation table: which roles may invoke an operation and from which states.
 *
 * <p>Target states are decided by the aggregate itself since {@code submitReview}
 * picks its target from the verdict and the approval threshold.
 *
 * <p>{@code merge} passes the guard from every review-phase state; anything short of
 * APPROVED with enough approvals and no change requests is then refused by merge
 * validation (MergeNotEligible). Outside the review phase the guard rejects it.
 */
public enum PullRequestOperation {
    UPDATE_DETAILS("updateDetails", EnumSet.of(AUTHOR),
            EnumSet.of(DRAFT, OPEN, REVIEW_REQUESTED, CHANGES_REQUESTED)),
    ADD_FILES("addFiles", EnumSet.of(AUTHOR),
            EnumSet.of(DRAFT, OPEN, REVIEW_REQUESTED, CHANGES_REQUESTED)),
    MARK_READY_FOR_REVIEW("markReadyForReview", EnumSet.of(AUTHOR), EnumSet.of(DRAFT)),
    CONVERT_TO_DRAFT("convertToDraft", EnumSet.of(AUTHOR), EnumSet.of(OPEN, REVIEW_REQUESTED)),
    REQUEST_REVIEW("requestReview", EnumSet.of(REVIEWER), EnumSet.of(OPEN)),
    SUBMIT_REVIEW("submitReview", EnumSet.of(REVIEWER),
            EnumSet.of(REVIEW_REQUESTED, IN_REVIEW, CHANGES_REQUESTED)),
    ADD_COMMENT("addComment", EnumSet.of(REVIEWER, MAINTAINER),
            EnumSet.of(OPEN, REVIEW_REQUESTED, IN_REVIEW, CHANGES_REQUESTED)),
    SET_REQUIRED_APPROVALS("setRequiredApprovals", EnumSet.of(MAINTAINER),
            EnumSet.of(DRAFT, OPEN, REVIEW_REQUESTED)),
    MERGE("merge", EnumSet.of(MAINTAINER),
            EnumSet.of(REVIEW_REQUESTED, IN_REVIEW, CHANGES_REQUESTED, APPROVED)),
    CLOSE("close", EnumSet.of(MAINTAINER),
            EnumSet.of(DRAFT, OPEN, REVIEW_REQUESTED, IN_REVIEW, CHANGES_REQUESTED, APPROVED)),
    REOPEN("reopen", EnumSet.of(MAINTAINER), EnumSet.of(CLOSED)),
    RESPOND_TO_REVIEW("respondToReview", EnumSet.of(AUTHOR),
            EnumSet.of(IN_REVIEW, CHANGES_REQUESTED, APPROVED)),
    VIEW("view", EnumSet.allOf(PartyRole.class), EnumSet.allOf(PullRequestState.class));

    private final String operationName;
    private final Set<PartyRole> requiredRoles;
    private final Set<PullRequestState> sourceStates;

    PullRequestOperation(String operationName, Set<PartyRole> requiredRoles,
                         Set<PullRequestState> sourceStates) {
        this.operationName = operationName;
        this.requiredRoles = requiredRoles;
        this.sourceStates = sourceStates;
    }

    public String getOperationName() {
        return operationName;
    }

    public Set<PartyRole> getRequiredRoles() {
        return EnumSet.copyOf(requiredRoles);
    }

    public Set<PullRequestState> getSourceStates() {
        return EnumSet.copyOf(sourceStates);
    }

    public boolean permitsState(PullRequestState state) {
        return sourceStates.contains(state);
    }
}
