package com.codelogickeep.coverage.model;

import com.codelogickeep.coverage.util.Percentages;
import lombok.Data;

/**
 * Coverage counts and percentages for one node of the coverage tree (or the whole run).
 */
@Data
public class CoverageSummary {
    private double linesCoveredPercentage;
    private double branchesCoveredPercentage;
    private double methodsCoveredPercentage;
    private double classesCoveredPercentage;

    private int totalLines;
    private int coveredLines;
    private int uncoveredLines;

    private int totalBranches;
    private int coveredBranches;
    private int uncoveredBranches;

    private int totalMethods;
    private int coveredMethods;
    private int uncoveredMethods;

    private int totalClasses;
    private int coveredClasses;
    private int uncoveredClasses;

    /** Sets line counts and derives the uncovered count and percentage. */
    public void recordLines(int total, int covered) {
        int bounded = Math.min(covered, total);
        this.totalLines = total;
        this.coveredLines = bounded;
        this.uncoveredLines = total - bounded;
        this.linesCoveredPercentage = Percentages.of(bounded, total);
    }

    public void recordBranches(int total, int covered) {
        int bounded = Math.min(covered, total);
        this.totalBranches = total;
        this.coveredBranches = bounded;
        this.uncoveredBranches = total - bounded;
        this.branchesCoveredPercentage = Percentages.of(bounded, total);
    }

    public void recordMethods(int total, int covered) {
        int bounded = Math.min(covered, total);
        this.totalMethods = total;
        this.coveredMethods = bounded;
        this.uncoveredMethods = total - bounded;
        this.methodsCoveredPercentage = Percentages.of(bounded, total);
    }

    public void recordClasses(int total, int covered) {
        int bounded = Math.min(covered, total);
        this.totalClasses = total;
        this.coveredClasses = bounded;
        this.uncoveredClasses = total - bounded;
        this.classesCoveredPercentage = Percentages.of(bounded, total);
    }

    public CoverageSummary copy() {
        CoverageSummary copy = new CoverageSummary();
        copy.linesCoveredPercentage = linesCoveredPercentage;
        copy.branchesCoveredPercentage = branchesCoveredPercentage;
        copy.methodsCoveredPercentage = methodsCoveredPercentage;
        copy.classesCoveredPercentage = classesCoveredPercentage;
        copy.totalLines = totalLines;
        copy.coveredLines = coveredLines;
        copy.uncoveredLines = uncoveredLines;
        copy.totalBranches = totalBranches;
        copy.coveredBranches = coveredBranches;
        copy.uncoveredBranches = uncoveredBranches;
        copy.totalMethods = totalMethods;
        copy.coveredMethods = coveredMethods;
        copy.uncoveredMethods = uncoveredMethods;
        copy.totalClasses = totalClasses;
        copy.coveredClasses = coveredClasses;
        copy.uncoveredClasses = uncoveredClasses;
        return copy;
    }
}
