package dev.reviewgate.dto.response;

import dev.reviewgate.domain.enums.PullRequestState;

import java.time.Instant;
import java.util.UUID;

/**
 * Result shapes returned by the mutating operations.
 */
public final class OperationResults {

    private OperationResults() {
    }

    public record Created(UUID id, PullRequestState state) {}

    public record StateChanged(UUID id, PullRequestState state, Instant updatedAt) {}

    public record DetailsUpdated(UUID id, Instant createdAt, Instant updatedAt) {}

    public record FilesAdded(UUID id, int fileCount) {}

    public record ReviewSubmitted(UUID reviewId, PullRequestState state, int approvalCount) {}

    public record CommentAdded(UUID commentId) {}

    public record RequiredApprovalsChanged(UUID id, int requiredApprovals) {}

    public record Merged(UUID id, String commitId, PullRequestState state) {}

    public record ResponseRecorded(UUID responseId) {}
}
