package dev.reviewgate.domain.valueobject;

/**
 * Counts derived from the review collection at one point in time. Never persisted.
 */
public record ReviewTally(int reviewCount, int approvalCount, int changesRequestedCount, int commentCount) {

    public static final ReviewTally EMPTY = new ReviewTally(0, 0, 0, 0);

    /**
     * Any REQUEST_CHANGES review counts, even if the same reviewer approved later.
     */
    public boolean hasUnresolvedChangeRequests() {
        return changesRequestedCount > 0;
    }

    public boolean meetsThreshold(int requiredApprovals) {
        return approvalCount >= requiredApprovals;
    }
}
