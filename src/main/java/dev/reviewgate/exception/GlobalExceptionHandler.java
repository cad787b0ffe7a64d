package dev.reviewgate.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.net.URI;
import java.time.Instant;

/**
 * Global exception handler using RFC 7807 Problem Details.
 *
 * <p>Each workflow failure kind keeps its own type URI and code, so authorization
 * and state-guard failures stay distinguishable from validation failures even where
 * they share a status. Internal exception messages of unexpected errors are logged
 * server-side only.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    private static final String TYPE_BASE = "https://reviewgate.dev/errors/";

    @ExceptionHandler(AuthorizationDeniedException.class)
    public ProblemDetail handleAuthorizationDenied(AuthorizationDeniedException ex) {
        log.warn("Authorization denied for {}: {}", ex.getCaller(), ex.getMessage());
        ProblemDetail problem = problem(HttpStatus.FORBIDDEN, "authorization-denied", "Authorization Denied", ex);
        problem.setProperty("operation", ex.getOperation().getOperationName());
        return problem;
    }

    @ExceptionHandler(StateGuardViolationException.class)
    public ProblemDetail handleStateGuard(StateGuardViolationException ex) {
        log.warn("State guard violation: {}", ex.getMessage());
        ProblemDetail problem = problem(HttpStatus.CONFLICT, "state-guard-violation", "State Guard Violation", ex);
        problem.setProperty("operation", ex.getOperation().getOperationName());
        problem.setProperty("currentState", ex.getCurrentState().getIdentifier());
        return problem;
    }

    @ExceptionHandler(ValidationFailedException.class)
    public ProblemDetail handleValidation(ValidationFailedException ex) {
        log.warn("Validation failed [{}]: {}", ex.getRule(), ex.getMessage());
        ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, "validation-failed", "Validation Failed", ex);
        problem.setProperty("rule", ex.getRule());
        return problem;
    }

    @ExceptionHandler(MergeNotEligibleException.class)
    public ProblemDetail handleMergeNotEligible(MergeNotEligibleException ex) {
        log.warn("Merge not eligible: {}", ex.getMessage());
        ProblemDetail problem = problem(HttpStatus.UNPROCESSABLE_ENTITY, "merge-not-eligible", "Merge Not Eligible", ex);
        problem.setProperty("pullRequestId", ex.getPullRequestId());
        return problem;
    }

    @ExceptionHandler(PullRequestNotFoundException.class)
    public ProblemDetail handleNotFound(PullRequestNotFoundException ex) {
        return problem(HttpStatus.NOT_FOUND, "not-found", "Pull Request Not Found", ex);
    }

    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ProblemDetail handleConcurrentModification(ObjectOptimisticLockingFailureException ex) {
        log.warn("Concurrent modification: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.CONFLICT,
                "The pull request was modified concurrently. Reload and retry.");
        problem.setType(URI.create(TYPE_BASE + "concurrent-modification"));
        problem.setTitle("Concurrent Modification");
        problem.setProperty("code", "CONCURRENT_MODIFICATION");
        problem.setProperty("timestamp", Instant.now());
        return problem;
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class})
    public ProblemDetail handleBadRequest(Exception ex) {
        log.warn("Bad request: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        problem.setType(URI.create(TYPE_BASE + "bad-request"));
        problem.setTitle("Invalid Request");
        problem.setProperty("timestamp", Instant.now());
        return problem;
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "An unexpected error occurred. Please try again later.");
        problem.setType(URI.create(TYPE_BASE + "internal"));
        problem.setTitle("Internal Server Error");
        problem.setProperty("timestamp", Instant.now());
        return problem;
    }

    private static ProblemDetail problem(HttpStatus status, String type, String title,
                                         PullRequestWorkflowException ex) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        problem.setType(URI.create(TYPE_BASE + type));
        problem.setTitle(title);
        problem.setProperty("code", ex.getCode());
        problem.setProperty("timestamp", Instant.now());
        return problem;
    }
}
