package dev.reviewgate.domain.workflow;

import dev.reviewgate.domain.entity.Review;
import dev.reviewgate.domain.enums.PullRequestState;
import dev.reviewgate.domain.enums.Verdict;
import dev.reviewgate.domain.valueobject.ReviewTally;

import java.util.List;

/**
 * Derives review counts, picks the state a new review leads to and decides mergeability.
 */
public final class ReviewAggregator {

    private ReviewAggregator() {
    }

    public static ReviewTally tally(List<Review> reviews) {
        if (reviews == null || reviews.isEmpty()) return ReviewTally.EMPTY;
        int approvals = 0;
        int changeRequests = 0;
        int comments = 0;
        for (Review review : reviews) {
            if (review.getVerdict() == Verdict.APPROVE) approvals++;
            else if (review.getVerdict() == Verdict.REQUEST_CHANGES) changeRequests++;
            comments += review.getCommentCount();
        }
        return new ReviewTally(reviews.size(), approvals, changeRequests, comments);
    }

    /**
     * State after a review with {@code verdict} has been appended.
     *
     * @param current state before the review
     * @param tally   counts including the new review
     */
    public static PullRequestState nextState(PullRequestState current, Verdict verdict,
                                             ReviewTally tally, int requiredApprovals) {
        return switch (verdict) {
            case REQUEST_CHANGES -> PullRequestState.CHANGES_REQUESTED;
            case APPROVE -> tally.meetsThreshold(requiredApprovals)
                    ? PullRequestState.APPROVED
                    : PullRequestState.IN_REVIEW;
            case COMMENT -> current == PullRequestState.IN_REVIEW || current == PullRequestState.CHANGES_REQUESTED
                    ? current
                    : PullRequestState.IN_REVIEW;
        };
    }

    public static boolean canMerge(PullRequestState state, ReviewTally tally, int requiredApprovals) {
        return mergeBlocker(state, tally, requiredApprovals) == null;
    }

    /**
     * Why the pull request cannot merge, or null if it can.
     */
    public static String mergeBlocker(PullRequestState state, ReviewTally tally, int requiredApprovals) {
        if (state != PullRequestState.APPROVED) {
            return "state is %s, must be %s".formatted(state, PullRequestState.APPROVED);
        }
        if (!tally.meetsThreshold(requiredApprovals)) {
            return "needs %d approvals, has %d".formatted(requiredApprovals, tally.approvalCount());
        }
        if (tally.hasUnresolvedChangeRequests()) {
            return "%d unresolved change request(s)".formatted(tally.changesRequestedCount());
        }
        return null;
    }
}
