package dev.reviewgate.domain.workflow;

import dev.reviewgate.exception.ValidationFailedException;

/**
 * Field-level checks shared by the aggregate and its value types. Each failure names
 * the rule so callers can tell which constraint was violated.
 */
public final class WorkflowRules {

    public static final int MAX_TITLE_LENGTH = 200;
    public static final int MIN_REQUIRED_APPROVALS = 1;
    public static final int MAX_REQUIRED_APPROVALS = 10;

    // Column sizes in V1__create_pull_requests.sql
    public static final int MAX_IDENTITY_LENGTH = 255;
    public static final int MAX_BRANCH_LENGTH = 255;
    public static final int MAX_PATH_LENGTH = 1024;
    public static final int MAX_DESCRIPTION_LENGTH = 8000;
    public static final int MAX_TEXT_LENGTH = 4000;
    public static final int MAX_CLOSE_REASON_LENGTH = 2000;

    private WorkflowRules() {
    }

    public static String requireText(String value, String rule, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationFailedException(rule, field + " must not be empty");
        }
        return value;
    }

    /** Null passes; optional fields are checked only when present. */
    public static String requireMaxLength(String value, int max, String rule, String field) {
        if (value != null && value.length() > max) {
            throw new ValidationFailedException(rule,
                    "%s must be at most %d characters, was %d".formatted(field, max, value.length()));
        }
        return value;
    }

    public static String requireTitle(String title) {
        requireText(title, "title.required", "title");
        if (title.length() > MAX_TITLE_LENGTH) {
            throw new ValidationFailedException("title.length",
                    "title must be at most %d characters, was %d".formatted(MAX_TITLE_LENGTH, title.length()));
        }
        return title;
    }

    public static int requireApprovalThreshold(int requiredApprovals) {
        if (requiredApprovals < MIN_REQUIRED_APPROVALS || requiredApprovals > MAX_REQUIRED_APPROVALS) {
            throw new ValidationFailedException("requiredApprovals.range",
                    "requiredApprovals must be between %d and %d, was %d"
                            .formatted(MIN_REQUIRED_APPROVALS, MAX_REQUIRED_APPROVALS, requiredApprovals));
        }
        return requiredApprovals;
    }

    public static int requirePositiveLine(int lineNumber) {
        if (lineNumber <= 0) {
            throw new ValidationFailedException("comment.lineNumber",
                    "lineNumber must be positive, was " + lineNumber);
        }
        return lineNumber;
    }

    public static int requireNonNegative(int value, String rule, String field) {
        if (value < 0) {
            throw new ValidationFailedException(rule, field + " must not be negative, was " + value);
        }
        return value;
    }
}
