package com.codelogickeep.coverage.model;

import lombok.Data;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Test counts of one or more test runs. {@code totalTests} always equals
 * passed + failed + skipped.
 */
@Data
public class TestExecutionSummary {
    private int totalTests;
    private int passedTests;
    private int failedTests;
    private int skippedTests;
    private Duration executionTime = Duration.ZERO;
    private List<TestFailure> failures = new ArrayList<>();

    public boolean isAllTestsPassed() {
        return failedTests == 0;
    }

    /** Adds the counts, time and failures of another summary to this one. */
    public void add(TestExecutionSummary other) {
        if (other == null) {
            return;
        }
        totalTests += other.totalTests;
        passedTests += other.passedTests;
        failedTests += other.failedTests;
        skippedTests += other.skippedTests;
        if (other.executionTime != null) {
            executionTime = executionTime.plus(other.executionTime);
        }
        if (other.failures != null) {
            failures.addAll(other.failures);
        }
    }
}
