package dev.reviewgate.dto.response;

import dev.reviewgate.domain.enums.ChangeType;
import dev.reviewgate.domain.enums.PullRequestState;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record PullRequestSummary(
        UUID id, String title, String description, String sourceBranch, String targetBranch,
        PullRequestState state, String author, List<String> reviewers, String maintainer,
        int requiredApprovals, List<FileSummary> files, int linesAdded, int linesDeleted,
        int reviewCount, int approvalCount, int changesRequestedCount, int commentCount,
        int discussionCommentCount, int responseCount, boolean hasUnresolvedChangeRequests, boolean canMerge,
        String mergeCommitId, Instant mergedAt, String mergedBy, Instant closedAt, String closeReason,
        Instant createdAt, Instant updatedAt, Long version
) {
    public record FileSummary(String path, ChangeType changeType, int linesAdded, int linesDeleted,
                              String oldPath) {}
}
