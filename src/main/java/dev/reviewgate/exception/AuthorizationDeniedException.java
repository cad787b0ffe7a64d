package dev.reviewgate.exception;

import dev.reviewgate.domain.workflow.PullRequestOperation;

/**
 * Caller identity is not a member of any role the operation requires.
 */
public class AuthorizationDeniedException extends PullRequestWorkflowException {

    private final String caller;
    private final PullRequestOperation operation;

    public AuthorizationDeniedException(String caller, PullRequestOperation operation, String reason) {
        super("AUTHORIZATION_DENIED", reason);
        this.caller = caller;
        this.operation = operation;
    }

    public String getCaller() {
        return caller;
    }

    public PullRequestOperation getOperation() {
        return operation;
    }
}
