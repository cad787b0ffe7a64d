package dev.reviewgate.dto.request;

public record MergePullRequestRequest(String commitMessage) {
}
