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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CoverageComparator Tests")
class CoverageComparatorTest {

    private CoverageComparator comparator;

    @BeforeEach
    void setUp() {
        comparator = new CoverageComparator();
    }

    private static CoverageAnalysisResult snapshot(int totalLines, int coveredLines) {
        CoverageAnalysisResult result = new CoverageAnalysisResult();
        result.setSuccess(true);
        result.getSummary().recordLines(totalLines, coveredLines);
        ProjectCoverage project = new ProjectCoverage();
        project.setProjectName("Calc");
        result.getProjects().add(project);
        return result;
    }

    private static FileCoverage fileWithLinePct(String path, double pct) {
        FileCoverage file = new FileCoverage();
        file.setFilePath(path);
        file.getSummary().setLinesCoveredPercentage(pct);
        return file;
    }

    private static void addMethod(CoverageAnalysisResult result, String className, String name, double pct) {
        ProjectCoverage project = result.getProjects().get(0);
        ClassCoverage cls = project.getClasses().stream()
                .filter(c -> c.getClassName().equals(className))
                .findFirst()
                .orElseGet(() -> {
                    ClassCoverage created = new ClassCoverage();
                    created.setClassName(className);
                    project.getClasses().add(created);
                    return created;
                });
        MethodCoverage method = new MethodCoverage();
        method.setClassName(className);
        method.setMethodName(name);
        method.setSignature("()");
        method.getSummary().setLinesCoveredPercentage(pct);
        cls.getMethods().add(method);
    }

    @Nested
    @DisplayName("invalid input")
    class InvalidInput {

        @Test
        @DisplayName("should fail without throwing for a missing baseline")
        void shouldFailForMissingBaseline() {
            CoverageComparisonResult result = assertDoesNotThrow(() -> comparator.compare(null, snapshot(10, 5)));

            assertFalse(result.isSuccess());
            assertNotNull(result.getErrorMessage());
        }

        @Test
        @DisplayName("should fail for an unsuccessful baseline")
        void shouldFailForUnsuccessfulBaseline() {
            CoverageAnalysisResult baseline = CoverageAnalysisResult.failure(ErrorCode.NO_COVERAGE_DATA, "tests crashed");

            CoverageComparisonResult result = comparator.compare(baseline, snapshot(10, 5));

            assertFalse(result.isSuccess());
            assertTrue(result.getErrorMessage().contains("tests crashed"));
            assertEquals(ErrorCode.COMPARISON_FAILED, result.getErrorCode());
        }

        @Test
        @DisplayName("should fail for a baseline without summary")
        void shouldFailForBaselineWithoutSummary() {
            CoverageAnalysisResult baseline = snapshot(10, 5);
            baseline.setSummary(null);

            assertFalse(comparator.compare(baseline, snapshot(10, 5)).isSuccess());
        }

        @Test
        @DisplayName("should fail when the current analysis failed")
        void shouldFailWhenCurrentFailed() {
            CoverageComparisonResult result = comparator.compare(snapshot(10, 5),
                    CoverageAnalysisResult.failure(ErrorCode.NO_TEST_PROJECTS, "No test projects found in the workspace."));

            assertFalse(result.isSuccess());
            assertTrue(result.getErrorMessage().startsWith("Failed to run current coverage analysis"));
            assertTrue(result.getErrorMessage().contains("No test projects found"));
            assertEquals(ErrorCode.NO_TEST_PROJECTS, result.getErrorCode());
        }
    }

    @Nested
    @DisplayName("deltas")
    class Deltas {

        @Test
        @DisplayName("should report percentage point and covered count changes")
        void shouldReportChanges() {
            CoverageComparisonResult result = comparator.compare(snapshot(100, 60), snapshot(100, 75));

            assertTrue(result.isSuccess());
            CoverageDelta delta = result.getDelta();
            assertEquals(15.0, delta.getLinesCoverageChange());
            assertEquals(15, delta.getLinesChange());
            assertTrue(delta.isImprovement());
            assertFalse(delta.isRegression());
            assertEquals(60.0, result.getBaselineCoverage().getLinesCoveredPercentage());
            assertEquals(75.0, result.getCurrentCoverage().getLinesCoveredPercentage());
        }

        @Test
        @DisplayName("should treat identical snapshots as unchanged")
        void shouldTreatIdenticalSnapshotsAsUnchanged() {
            CoverageAnalysisResult snapshot = snapshot(100, 60);
            snapshot.getProjects().get(0).getFiles().add(fileWithLinePct("src/A.cs", 60.0));
            addMethod(snapshot, "Calc.A", "Run", 0.0);

            CoverageComparisonResult result = comparator.compare(snapshot, snapshot);

            assertTrue(result.isSuccess());
            assertTrue(result.getDelta().isUnchanged());
            assertEquals(0, result.getDelta().getLinesChange());
            assertTrue(result.getImprovedFiles().isEmpty());
            assertTrue(result.getRegressedFiles().isEmpty());
            assertTrue(result.getNewlyCoveredMethods().isEmpty());
            assertTrue(result.getNewlyUncoveredMethods().isEmpty());
        }

        @Test
        @DisplayName("should round deltas to two decimals")
        void shouldRoundDeltas() {
            CoverageSummary before = new CoverageSummary();
            before.setLinesCoveredPercentage(33.33);
            CoverageSummary after = new CoverageSummary();
            after.setLinesCoveredPercentage(66.67);

            assertEquals(33.34, comparator.delta(before, after).getLinesCoverageChange());
        }
    }

    @Nested
    @DisplayName("files and methods")
    class FilesAndMethods {

        @Test
        @DisplayName("should classify improved, regressed, added and removed files")
        void shouldClassifyFiles() {
            CoverageAnalysisResult baseline = snapshot(100, 50);
            List<FileCoverage> before = baseline.getProjects().get(0).getFiles();
            before.add(fileWithLinePct("src/Better.cs", 40.0));
            before.add(fileWithLinePct("src/Worse.cs", 90.0));
            before.add(fileWithLinePct("src/Same.cs", 70.0));
            before.add(fileWithLinePct("src/Gone.cs", 10.0));

            CoverageAnalysisResult current = snapshot(100, 55);
            List<FileCoverage> after = current.getProjects().get(0).getFiles();
            after.add(fileWithLinePct("src\\Better.cs", 60.0));
            after.add(fileWithLinePct("src/Worse.cs", 80.0));
            after.add(fileWithLinePct("src/./Same.cs", 70.004));
            after.add(fileWithLinePct("src/New.cs", 0.0));

            CoverageComparisonResult result = comparator.compare(baseline, current);

            assertEquals(List.of("src/Better.cs"), result.getImprovedFiles());
            assertEquals(List.of("src/Worse.cs"), result.getRegressedFiles());
            assertEquals(List.of("src/New.cs"), result.getAddedFiles());
            assertEquals(List.of("src/Gone.cs"), result.getRemovedFiles());
        }

        @Test
        @DisplayName("should detect newly covered and newly uncovered methods")
        void shouldDetectMethodTransitions() {
            CoverageAnalysisResult baseline = snapshot(10, 5);
            addMethod(baseline, "Calc.Calculator", "Add", 0.0);
            addMethod(baseline, "Calc.Calculator", "Divide", 100.0);
            addMethod(baseline, "Calc.Calculator", "Removed", 0.0);

            CoverageAnalysisResult current = snapshot(10, 5);
            addMethod(current, "Calc.Calculator", "Add", 50.0);
            addMethod(current, "Calc.Calculator", "Divide", 0.0);
            addMethod(current, "Calc.Calculator", "Brand", 0.0);

            CoverageComparisonResult result = comparator.compare(baseline, current);

            assertEquals(List.of("Calc.Calculator.Add()"), result.getNewlyCoveredMethods());
            assertEquals(List.of("Calc.Calculator.Brand()", "Calc.Calculator.Divide()"),
                    result.getNewlyUncoveredMethods());
        }
    }
}
