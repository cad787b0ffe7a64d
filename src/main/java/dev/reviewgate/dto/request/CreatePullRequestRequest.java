package dev.reviewgate.dto.request;

import java.util.List;
import java.util.Set;

/**
 * Body of POST /pull-requests. The caller becomes the author; requiredApprovals falls
 * back to the configured default when omitted.
 */
public record CreatePullRequestRequest(
        String title,
        String description,
        String sourceBranch,
        String targetBranch,
        List<FileChangeRequest> fileChanges,
        Set<String> reviewers,
        String maintainer,
        Integer requiredApprovals
) {
}
