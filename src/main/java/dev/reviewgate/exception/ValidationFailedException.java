package dev.reviewgate.exception;

/**
 * A structural or business rule rejected the arguments. {@link #getRule()} names the rule.
 */
public class ValidationFailedException extends PullRequestWorkflowException {

    private final String rule;

    public ValidationFailedException(String rule, String message) {
        super("VALIDATION_FAILED", message);
        this.rule = rule;
    }

    public String getRule() {
        return rule;
    }
}
