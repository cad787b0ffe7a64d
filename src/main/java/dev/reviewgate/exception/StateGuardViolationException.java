package dev.reviewgate.exception;

import dev.reviewgate.domain.enums.PullRequestState;
import dev.reviewgate.domain.workflow.PullRequestOperation;

/**
 * Operation is not legal from the aggregate's current state. Retries that arrive
 * after the aggregate has moved on land here as well.
 */
public class StateGuardViolationException extends PullRequestWorkflowException {

    private final PullRequestOperation operation;
    private final PullRequestState currentState;

    public StateGuardViolationException(PullRequestOperation operation, PullRequestState currentState,
                                        String message) {
        super("STATE_GUARD_VIOLATION", message);
        this.operation = operation;
        this.currentState = currentState;
    }

    public PullRequestOperation getOperation() {
        return operation;
    }

    public PullRequestState getCurrentState() {
        return currentState;
    }
}
