package com.codelogickeep.coverage.model;

import com.codelogickeep.coverage.exception.CoverageAnalysisException.ErrorCode;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Flat lists of code that no test executed.
 */
@Data
public class UncoveredCodeResult {
    private boolean success;
    private String errorMessage;
    private ErrorCode errorCode;
    private List<UncoveredMethod> uncoveredMethods = new ArrayList<>();
    private List<UncoveredLine> uncoveredLines = new ArrayList<>();
    private List<UncoveredBranch> uncoveredBranches = new ArrayList<>();

    public int getTotalUncoveredItems() {
        return uncoveredMethods.size() + uncoveredLines.size() + uncoveredBranches.size();
    }

    public static UncoveredCodeResult failure(ErrorCode errorCode, String errorMessage) {
        UncoveredCodeResult result = new UncoveredCodeResult();
        result.setErrorCode(errorCode);
        result.setErrorMessage(errorMessage);
        return result;
    }
}
