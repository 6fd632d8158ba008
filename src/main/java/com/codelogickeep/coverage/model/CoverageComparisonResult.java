package com.codelogickeep.coverage.model;

import com.codelogickeep.coverage.exception.CoverageAnalysisException.ErrorCode;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of comparing a baseline snapshot with a fresh one.
 */
@Data
public class CoverageComparisonResult {
    private boolean success;
    private String errorMessage;
    private ErrorCode errorCode;
    private CoverageSummary baselineCoverage = new CoverageSummary();
    private CoverageSummary currentCoverage = new CoverageSummary();
    private CoverageDelta delta = new CoverageDelta();
    private List<String> improvedFiles = new ArrayList<>();
    private List<String> regressedFiles = new ArrayList<>();
    /** Files only present in the current snapshot */
    private List<String> addedFiles = new ArrayList<>();
    /** Files only present in the baseline snapshot */
    private List<String> removedFiles = new ArrayList<>();
    private List<String> newlyUncoveredMethods = new ArrayList<>();
    private List<String> newlyCoveredMethods = new ArrayList<>();

    public static CoverageComparisonResult failure(ErrorCode errorCode, String errorMessage) {
        CoverageComparisonResult result = new CoverageComparisonResult();
        result.setErrorCode(errorCode);
        result.setErrorMessage(errorMessage);
        return result;
    }
}
