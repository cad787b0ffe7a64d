package dev.reviewgate.dto.response;

import dev.reviewgate.domain.enums.PullRequestState;

import java.util.UUID;

/** blocker is null when canMerge is true. */
public record MergeabilityResponse(UUID id, boolean canMerge, PullRequestState state, String blocker) {
}
