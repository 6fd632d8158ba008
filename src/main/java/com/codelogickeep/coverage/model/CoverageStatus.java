package com.codelogickeep.coverage.model;

/**
 * Coverage status for a line of code.
 */
public enum CoverageStatus {
    NOT_COVERABLE,
    COVERED,
    UNCOVERED,
    PARTIALLY_COVERED
}
