package com.codelogickeep.coverage.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Coverage of a single method. The percentages in {@link #getSummary()} are the rates
 * reported by the instrumentation tool; the counts are derived from the method's lines.
 */
@Data
public class MethodCoverage {
    private String methodName = "";
    private String className = "";
    private String signature = "";
    private int startLine;
    private int endLine;
    private CoverageSummary summary = new CoverageSummary();
    private List<LineCoverage> lines = new ArrayList<>();
    private List<BranchCoverage> branches = new ArrayList<>();

    public boolean isFullyCovered() {
        return summary.getLinesCoveredPercentage() >= 100.0;
    }

    public boolean isPartiallyCovered() {
        double pct = summary.getLinesCoveredPercentage();
        return pct > 0.0 && pct < 100.0;
    }

    public boolean isUncovered() {
        return summary.getLinesCoveredPercentage() == 0.0;
    }

    /** Identifier used to match a method across snapshots, e.g. {@code Ns.Calculator.Add(int,int)} */
    public String getIdentifier() {
        return className + "." + methodName + signature;
    }

    public boolean containsLine(int lineNumber) {
        return startLine > 0 && lineNumber >= startLine && lineNumber <= endLine;
    }
}
