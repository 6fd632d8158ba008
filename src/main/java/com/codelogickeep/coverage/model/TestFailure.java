package com.codelogickeep.coverage.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A failed test reported in a test run transcript.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TestFailure {
    private String testName;
    private String testClass;
    private String errorMessage;
    private String stackTrace;
}
