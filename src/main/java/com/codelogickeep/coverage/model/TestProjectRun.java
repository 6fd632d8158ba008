package com.codelogickeep.coverage.model;

import com.codelogickeep.coverage.exception.CoverageAnalysisException.ErrorCode;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of executing one test project under coverage.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TestProjectRun {
    private String projectName;
    private String projectPath;
    private boolean success;
    private String errorMessage;
    private ErrorCode errorCode;
    /** Exit code of the test process, or -1 when it did not exit normally */
    private int exitCode;
    private Duration duration;
    /** Path of the produced coverage report, or null */
    private String coverageReportPath;
    private TestExecutionSummary testSummary;

    @JsonIgnore
    private List<String> outputLines;

    @JsonIgnore
    private List<String> errorLines;

    /** Marks this run as failed. Only used before the run is handed to a caller. */
    public void fail(ErrorCode code, String message) {
        this.success = false;
        this.errorCode = code;
        this.errorMessage = message;
    }
}
