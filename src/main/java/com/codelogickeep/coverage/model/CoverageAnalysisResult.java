package com.codelogickeep.coverage.model;

import com.codelogickeep.coverage.exception.CoverageAnalysisException.ErrorCode;
import lombok.Data;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Result of a complete coverage analysis run (a snapshot).
 */
@Data
public class CoverageAnalysisResult {
    private boolean success;
    private String errorMessage;
    /** Why the analysis failed; null on success, including partial success */
    private ErrorCode errorCode;
    private Instant analysisTime;
    private Duration executionDuration = Duration.ZERO;
    private CoverageSummary summary = new CoverageSummary();
    private List<ProjectCoverage> projects = new ArrayList<>();
    private TestExecutionSummary testResults = new TestExecutionSummary();
    private List<TestProjectRun> testProjectRuns = new ArrayList<>();

    public static CoverageAnalysisResult failure(ErrorCode errorCode, String errorMessage) {
        CoverageAnalysisResult result = new CoverageAnalysisResult();
        result.setAnalysisTime(Instant.now());
        result.setErrorCode(errorCode);
        result.setErrorMessage(errorMessage);
        return result;
    }
}
