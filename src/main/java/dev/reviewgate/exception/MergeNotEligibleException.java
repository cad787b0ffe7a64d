package dev.reviewgate.exception;

import java.util.UUID;

public class MergeNotEligibleException extends PullRequestWorkflowException {

    private final UUID pullRequestId;

    public MergeNotEligibleException(UUID pullRequestId, String message) {
        super("MERGE_NOT_ELIGIBLE", message);
        this.pullRequestId = pullRequestId;
    }

    public UUID getPullRequestId() {
        return pullRequestId;
    }
}
