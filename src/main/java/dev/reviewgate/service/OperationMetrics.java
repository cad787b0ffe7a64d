package dev.reviewgate.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Counts workflow operations by name and outcome ("success" or the failure code).
 */
@Component
public class OperationMetrics {

    static final String METER_NAME = "reviewgate.operations";

    private final MeterRegistry meterRegistry;

    public OperationMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void recordSuccess(String operation) {
        record(operation, "success");
    }

    public void recordFailure(String operation, String code) {
        record(operation, code);
    }

    private void record(String operation, String outcome) {
        Counter.builder(METER_NAME)
                .description("Pull request workflow operations")
                .tag("operation", operation)
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }
}
