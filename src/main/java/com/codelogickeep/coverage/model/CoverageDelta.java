package com.codelogickeep.coverage.model;

import lombok.Data;

/**
 * Change between two snapshots: percentage points for the rates, covered-item counts
 * for the counts.
 */
@Data
public class CoverageDelta {
    /** Changes smaller than this (in percentage points) count as unchanged */
    public static final double UNCHANGED_TOLERANCE = 0.01;

    private double linesCoverageChange;
    private double branchesCoverageChange;
    private double methodsCoverageChange;
    private double classesCoverageChange;

    private int linesChange;
    private int branchesChange;
    private int methodsChange;
    private int classesChange;

    public boolean isImprovement() {
        return linesCoverageChange > 0 && !isUnchanged();
    }

    public boolean isRegression() {
        return linesCoverageChange < 0 && !isUnchanged();
    }

    public boolean isUnchanged() {
        return Math.abs(linesCoverageChange) < UNCHANGED_TOLERANCE;
    }
}
