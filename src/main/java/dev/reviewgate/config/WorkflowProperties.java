package dev.reviewgate.config;

import dev.reviewgate.domain.workflow.WorkflowRules;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Workflow defaults. defaultRequiredApprovals applies when a create request omits the threshold;
 * it is 2 when unset and must lie within 1..10 otherwise.
 */
@ConfigurationProperties(prefix = "reviewgate.workflow")
public record WorkflowProperties(Integer defaultRequiredApprovals) {
    public WorkflowProperties {
        if (defaultRequiredApprovals == null) defaultRequiredApprovals = 2;
        WorkflowRules.requireApprovalThreshold(defaultRequiredApprovals);
    }
}
