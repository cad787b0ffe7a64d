package dev.reviewgate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * ReviewGate: pull request review workflow engine.
 *
 * <p>Architecture overview:
 * <pre>
 * PullRequestController → PullRequestService (transaction, optimistic lock)
 *   → PullRequest aggregate [AuthorizationGuard → state guard → validation → mutate → transition]
 *   → ApplicationEvent → (after commit) NotificationDispatcher → NotificationEmitter (SQS | log)
 * </pre>
 *
 * <p>Key design decisions:
 * <ul>
 *   <li>Protocol rules live in the aggregate and its workflow helpers, free of Spring</li>
 *   <li>One writer per pull request via {@code @Version}; conflicts are rejected, not merged</li>
 *   <li>Notifications leave the process only after the transition is committed</li>
 * </ul>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ReviewGateApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReviewGateApplication.class, args);
    }
}
