package dev.reviewgate.exception;

import java.util.UUID;

public class PullRequestNotFoundException extends PullRequestWorkflowException {

    public PullRequestNotFoundException(UUID id) {
        super("PULL_REQUEST_NOT_FOUND", "Pull request %s not found".formatted(id));
    }
}
