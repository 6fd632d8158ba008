package com.codelogickeep.coverage.engine;

import com.codelogickeep.coverage.exception.CoverageAnalysisException.ErrorCode;
import com.codelogickeep.coverage.model.ClassCoverage;
import com.codelogickeep.coverage.model.CoverageAnalysisResult;
import com.codelogickeep.coverage.model.CoverageComparisonResult;
import com.codelogickeep.coverage.model.CoverageDelta;
import com.codelogickeep.coverage.model.CoverageSummary;
import com.codelogickeep.coverage.model.FileCoverage;
import com.codelogickeep.coverage.model.MethodCoverage;
import com.codelogickeep.coverage.model.ProjectCoverage;
import com.codelogickeep.coverage.util.Percentages;
import com.codelogickeep.coverage.util.PathPatterns;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Compares two coverage snapshots. Never throws; invalid input yields an unsuccessful result.
 */
public class CoverageComparator {
    private static final Logger log = LoggerFactory.getLogger(CoverageComparator.class);

    public CoverageComparisonResult compare(CoverageAnalysisResult baseline, CoverageAnalysisResult current) {
        if (baseline == null) {
            return CoverageComparisonResult.failure(ErrorCode.COMPARISON_FAILED, "Baseline coverage result is required.");
        }
        if (!baseline.isSuccess()) {
            return CoverageComparisonResult.failure(ErrorCode.COMPARISON_FAILED, "Baseline coverage result is not a successful analysis"
                    + (baseline.getErrorMessage() != null ? ": " + baseline.getErrorMessage() : "."));
        }
        if (baseline.getSummary() == null) {
            return CoverageComparisonResult.failure(ErrorCode.COMPARISON_FAILED, "Baseline coverage result has no summary.");
        }
        if (current == null || !current.isSuccess()) {
            ErrorCode code = current != null && current.getErrorCode() != null ? current.getErrorCode() : ErrorCode.COMPARISON_FAILED;
            return CoverageComparisonResult.failure(code, "Failed to run current coverage analysis"
                    + (current != null && current.getErrorMessage() != null ? ": " + current.getErrorMessage() : "."));
        }

        try {
            CoverageComparisonResult result = new CoverageComparisonResult();
            result.setBaselineCoverage(baseline.getSummary().copy());
            result.setCurrentCoverage(current.getSummary().copy());
            result.setDelta(delta(baseline.getSummary(), current.getSummary()));
            compareFiles(baseline, current, result);
            compareMethods(baseline, current, result);
            result.setSuccess(true);
            return result;
        } catch (RuntimeException e) {
            log.error("Coverage comparison failed", e);
            return CoverageComparisonResult.failure(ErrorCode.COMPARISON_FAILED, "Coverage comparison failed: " + e.getMessage());
        }
    }

    CoverageDelta delta(CoverageSummary baseline, CoverageSummary current) {
        CoverageDelta delta = new CoverageDelta();
        delta.setLinesCoverageChange(Percentages.round(current.getLinesCoveredPercentage() - baseline.getLinesCoveredPercentage()));
        delta.setBranchesCoverageChange(Percentages.round(current.getBranchesCoveredPercentage() - baseline.getBranchesCoveredPercentage()));
        delta.setMethodsCoverageChange(Percentages.round(current.getMethodsCoveredPercentage() - baseline.getMethodsCoveredPercentage()));
        delta.setClassesCoverageChange(Percentages.round(current.getClassesCoveredPercentage() - baseline.getClassesCoveredPercentage()));
        delta.setLinesChange(current.getCoveredLines() - baseline.getCoveredLines());
        delta.setBranchesChange(current.getCoveredBranches() - baseline.getCoveredBranches());
        delta.setMethodsChange(current.getCoveredMethods() - baseline.getCoveredMethods());
        delta.setClassesChange(current.getCoveredClasses() - baseline.getCoveredClasses());
        return delta;
    }

    private void compareFiles(CoverageAnalysisResult baseline, CoverageAnalysisResult current, CoverageComparisonResult result) {
        Map<String, FileCoverage> baselineFiles = filesByPath(baseline);
        Map<String, FileCoverage> currentFiles = filesByPath(current);

        for (Map.Entry<String, FileCoverage> entry : currentFiles.entrySet()) {
            FileCoverage before = baselineFiles.get(entry.getKey());
            if (before == null) {
                result.getAddedFiles().add(entry.getKey());
                continue;
            }
            double change = Percentages.round(entry.getValue().getSummary().getLinesCoveredPercentage()
                    - before.getSummary().getLinesCoveredPercentage());
            if (change >= CoverageDelta.UNCHANGED_TOLERANCE) {
                result.getImprovedFiles().add(entry.getKey());
            } else if (change <= -CoverageDelta.UNCHANGED_TOLERANCE) {
                result.getRegressedFiles().add(entry.getKey());
            }
        }
        for (String path : baselineFiles.keySet()) {
            if (!currentFiles.containsKey(path)) {
                result.getRemovedFiles().add(path);
            }
        }
    }

    private void compareMethods(CoverageAnalysisResult baseline, CoverageAnalysisResult current, CoverageComparisonResult result) {
        Set<String> baselineZero = new TreeSet<>();
        Set<String> baselineAll = new TreeSet<>();
        collectMethods(baseline, baselineAll, baselineZero);

        Set<String> currentZero = new TreeSet<>();
        Set<String> currentAll = new TreeSet<>();
        collectMethods(current, currentAll, currentZero);

        Set<String> newlyUncovered = new TreeSet<>(currentZero);
        newlyUncovered.removeAll(baselineZero);

        Set<String> newlyCovered = new TreeSet<>(baselineZero);
        newlyCovered.retainAll(currentAll);
        newlyCovered.removeAll(currentZero);

        result.setNewlyUncoveredMethods(new ArrayList<>(newlyUncovered));
        result.setNewlyCoveredMethods(new ArrayList<>(newlyCovered));
    }

    private static void collectMethods(CoverageAnalysisResult analysis, Set<String> all, Set<String> zeroCoverage) {
        for (ProjectCoverage project : analysis.getProjects()) {
            for (ClassCoverage cls : project.getClasses()) {
                for (MethodCoverage method : cls.getMethods()) {
                    all.add(method.getIdentifier());
                    if (method.isUncovered()) {
                        zeroCoverage.add(method.getIdentifier());
                    }
                }
            }
        }
    }

    private static Map<String, FileCoverage> filesByPath(CoverageAnalysisResult analysis) {
        Map<String, FileCoverage> files = new TreeMap<>();
        for (ProjectCoverage project : analysis.getProjects()) {
            for (FileCoverage file : project.getFiles()) {
                files.putIfAbsent(PathPatterns.normalize(file.getFilePath()), file);
            }
        }
        return files;
    }
}
