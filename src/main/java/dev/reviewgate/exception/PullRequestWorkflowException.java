package dev.reviewgate.exception;

/**
 * Base for every failure the workflow engine reports to its caller. Each subtype
 * carries a stable machine code so the error surface can classify it uniformly.
 * Any of these aborts the operation with no observable state change.
 */
public abstract class PullRequestWorkflowException extends RuntimeException {

    private final String code;

    protected PullRequestWorkflowException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
