package com.codelogickeep.coverage.engine;

import com.codelogickeep.coverage.config.AppConfig;
import com.codelogickeep.coverage.exception.CoverageAnalysisException;
import com.codelogickeep.coverage.exception.CoverageAnalysisException.ErrorCode;
import com.codelogickeep.coverage.model.ClassCoverage;
import com.codelogickeep.coverage.model.CoverageAnalysisOptions;
import com.codelogickeep.coverage.model.CoverageAnalysisResult;
import com.codelogickeep.coverage.model.CoverageComparisonResult;
import com.codelogickeep.coverage.model.CoverageSummary;
import com.codelogickeep.coverage.model.FileCoverage;
import com.codelogickeep.coverage.model.MethodCoverage;
import com.codelogickeep.coverage.model.ProjectCoverage;
import com.codelogickeep.coverage.model.TestProjectRun;
import com.codelogickeep.coverage.model.UncoveredCodeResult;
import com.codelogickeep.coverage.parser.CoberturaReportParser;
import com.codelogickeep.coverage.parser.TestResultParser;
import com.codelogickeep.coverage.util.PathPatterns;
import com.codelogickeep.coverage.workspace.DescriptorWorkspaceLoader;
import com.codelogickeep.coverage.workspace.Workspace;
import com.codelogickeep.coverage.workspace.WorkspaceLoader;
import com.codelogickeep.coverage.workspace.WorkspaceProject;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Entry point of the coverage analysis: runs the test projects of the loaded workspace under
 * coverage and answers summary, uncovered-code, method and comparison queries.
 * <p>
 * Every operation returns a result object describing success or failure and never throws.
 * Each call runs a fresh analysis; only the workspace handle is kept between calls.
 */
@Slf4j
public class CoverageAnalysisEngine {

    public static final String NO_WORKSPACE_MESSAGE = "No workspace loaded. Please load a workspace first.";
    static final String NO_TEST_PROJECTS_MESSAGE = "No test projects found in the workspace.";
    static final String NO_COVERAGE_DATA_MESSAGE = "No coverage data was generated.";

    private final WorkspaceLoader workspaceLoader;
    private final ProjectDiscovery projectDiscovery;
    private final TestRunner testRunner;
    private final CoberturaReportParser reportParser;
    private final CoverageAggregator aggregator;
    private final UncoveredCodeExtractor uncoveredCodeExtractor;
    private final CoverageComparator comparator;

    private final AtomicReference<Workspace> workspace = new AtomicReference<>();

    public CoverageAnalysisEngine(WorkspaceLoader workspaceLoader,
                                  ProjectDiscovery projectDiscovery,
                                  TestRunner testRunner,
                                  CoberturaReportParser reportParser,
                                  CoverageAggregator aggregator,
                                  UncoveredCodeExtractor uncoveredCodeExtractor,
                                  CoverageComparator comparator) {
        this.workspaceLoader = workspaceLoader;
        this.projectDiscovery = projectDiscovery;
        this.testRunner = testRunner;
        this.reportParser = reportParser;
        this.aggregator = aggregator;
        this.uncoveredCodeExtractor = uncoveredCodeExtractor;
        this.comparator = comparator;
    }

    /**
     * Wires an engine from configuration, locating the test runner executable once.
     */
    public static CoverageAnalysisEngine create(AppConfig config) {
        TestToolchain toolchain = TestToolchain.locate(config.getToolchain());
        return new CoverageAnalysisEngine(
                new DescriptorWorkspaceLoader(config.getDiscovery()),
                new ProjectDiscovery(new TestProjectClassifier(config.getDiscovery())),
                new TestRunner(toolchain, config.getRunner(), new TestResultParser()),
                new CoberturaReportParser(),
                new CoverageAggregator(),
                new UncoveredCodeExtractor(),
                new CoverageComparator());
    }

    /**
     * Loads the workspace at the given path, replacing any workspace loaded before.
     *
     * @return false when the workspace could not be loaded; the previous workspace is kept
     */
    public boolean loadWorkspace(Path path) {
        try {
            Workspace loaded = workspaceLoader.load(path);
            workspace.set(loaded);
            log.info("Workspace loaded: {} ({} projects)", loaded.root(), loaded.projects().size());
            return true;
        } catch (IOException | RuntimeException e) {
            CoverageAnalysisException error = new CoverageAnalysisException(
                    ErrorCode.WORKSPACE_LOAD_FAILED, "Failed to load workspace " + path, e.getMessage(), e);
            log.error(error.toDisplayMessage());
            return false;
        }
    }

    public void useWorkspace(Workspace loaded) {
        workspace.set(loaded);
    }

    public boolean isWorkspaceLoaded() {
        return workspace.get() != null;
    }

    public Optional<Workspace> getWorkspace() {
        return Optional.ofNullable(workspace.get());
    }

    /**
     * Stops the analysis in progress: queued test projects are not started and running test
     * processes are destroyed. The next analysis starts normally.
     */
    public void cancel() {
        testRunner.cancel();
    }

    public CoverageAnalysisResult runCoverageAnalysis(CoverageAnalysisOptions options) {
        CoverageAnalysisOptions effective = options != null ? options : CoverageAnalysisOptions.defaults();
        Workspace current = workspace.get();
        if (current == null) {
            log.warn(NO_WORKSPACE_MESSAGE);
            return CoverageAnalysisResult.failure(ErrorCode.NO_WORKSPACE, NO_WORKSPACE_MESSAGE);
        }
        if (effective.getTimeoutMinutes() <= 0) {
            return CoverageAnalysisResult.failure(ErrorCode.CONFIG_INVALID,
                    "Timeout must be a positive number of minutes, got " + effective.getTimeoutMinutes());
        }
        testRunner.resetCancellation();

        Instant analysisTime = Instant.now();
        long start = System.nanoTime();
        CoverageAnalysisResult result;
        try {
            result = analyze(current, effective);
        } catch (CoverageAnalysisException e) {
            log.error("Coverage analysis failed: {}", e.toDisplayMessage());
            result = CoverageAnalysisResult.failure(e.getErrorCode(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Coverage analysis failed", e);
            result = CoverageAnalysisResult.failure(ErrorCode.UNKNOWN_ERROR, "Coverage analysis failed: " + e.getMessage());
        }
        result.setAnalysisTime(analysisTime);
        result.setExecutionDuration(Duration.ofNanos(System.nanoTime() - start));
        return result;
    }

    private CoverageAnalysisResult analyze(Workspace current, CoverageAnalysisOptions options) {
        List<WorkspaceProject> testProjects = projectDiscovery.selectTestProjects(current.projects(), options);
        if (testProjects.isEmpty()) {
            return CoverageAnalysisResult.failure(ErrorCode.NO_TEST_PROJECTS, NO_TEST_PROJECTS_MESSAGE);
        }

        List<TestProjectRun> runs = testRunner.runAll(testProjects, options);
        List<ProjectCoverage> parsed = new ArrayList<>();
        int reportsParsed = 0;
        for (TestProjectRun run : runs) {
            if (!run.isSuccess()) {
                continue;
            }
            if (run.getCoverageReportPath() == null) {
                run.fail(ErrorCode.REPORT_NOT_FOUND, "No coverage report was produced by " + run.getProjectName());
                log.warn(run.getErrorMessage());
                continue;
            }
            try {
                parsed.addAll(reportParser.parseReport(Paths.get(run.getCoverageReportPath()), run.getProjectName(), options));
                reportsParsed++;
            } catch (CoverageAnalysisException e) {
                run.fail(e.getErrorCode(), e.getMessage());
                log.warn("Coverage report of {} skipped: {}", run.getProjectName(), e.getMessage());
            }
        }

        CoverageAnalysisResult result = new CoverageAnalysisResult();
        result.setTestProjectRuns(runs);
        result.setTestResults(aggregator.mergeTestResults(runs));

        List<TestProjectRun> failed = runs.stream().filter(r -> !r.isSuccess()).collect(Collectors.toList());
        if (reportsParsed == 0) {
            result.setSuccess(false);
            result.setErrorCode(ErrorCode.NO_COVERAGE_DATA);
            result.setErrorMessage(NO_COVERAGE_DATA_MESSAGE + describeFailures(failed));
            return result;
        }

        List<ProjectCoverage> selected = new ArrayList<>();
        for (ProjectCoverage project : parsed) {
            if (UncoveredCodeExtractor.isProjectSelected(project.getProjectName(), options)) {
                removeExcludedFiles(project, options.getExcludedFiles());
                selected.add(project);
            }
        }

        List<ProjectCoverage> merged = aggregator.mergeProjects(selected);
        merged.forEach(aggregator::summarizeProject);
        result.setProjects(merged);
        aggregator.calculateOverallSummary(result);
        result.setSuccess(true);
        if (!failed.isEmpty()) {
            result.setErrorMessage(failed.size() + " of " + runs.size() + " test project(s) failed." + describeFailures(failed));
        }

        log.info("Coverage analysis finished: {} project(s), line coverage {}%",
                merged.size(), result.getSummary().getLinesCoveredPercentage());
        return result;
    }

    public CoverageSummary getCoverageSummary(CoverageAnalysisOptions options) {
        CoverageAnalysisResult result = runCoverageAnalysis(options);
        return result.isSuccess() ? result.getSummary() : new CoverageSummary();
    }

    public UncoveredCodeResult findUncoveredCode(CoverageAnalysisOptions options) {
        CoverageAnalysisOptions effective = options != null ? options : CoverageAnalysisOptions.defaults();
        if (!isWorkspaceLoaded()) {
            return UncoveredCodeResult.failure(ErrorCode.NO_WORKSPACE, NO_WORKSPACE_MESSAGE);
        }
        try {
            return uncoveredCodeExtractor.findUncovered(runCoverageAnalysis(effective), effective);
        } catch (RuntimeException e) {
            log.error("Failed to extract uncovered code", e);
            return UncoveredCodeResult.failure(ErrorCode.UNKNOWN_ERROR, "Failed to extract uncovered code: " + e.getMessage());
        }
    }

    /**
     * Finds one method of a fresh analysis. The class may be given by simple or qualified name;
     * both names match case-insensitively.
     */
    public Optional<MethodCoverage> getMethodCoverage(String className, String methodName, CoverageAnalysisOptions options) {
        if (className == null || className.isBlank() || methodName == null || methodName.isBlank()) {
            return Optional.empty();
        }
        CoverageAnalysisResult result = runCoverageAnalysis(options);
        if (!result.isSuccess()) {
            log.info("Method coverage unavailable: {}", result.getErrorMessage());
            return Optional.empty();
        }
        return findMethod(result, className.trim(), methodName.trim());
    }

    static Optional<MethodCoverage> findMethod(CoverageAnalysisResult result, String className, String methodName) {
        for (ProjectCoverage project : result.getProjects()) {
            for (ClassCoverage cls : project.getClasses()) {
                if (!classMatches(cls.getClassName(), className)) {
                    continue;
                }
                for (MethodCoverage method : cls.getMethods()) {
                    if (method.getMethodName().equalsIgnoreCase(methodName)) {
                        return Optional.of(method);
                    }
                }
            }
        }
        return Optional.empty();
    }

    public CoverageComparisonResult compareCoverage(CoverageAnalysisResult baseline, CoverageAnalysisOptions options) {
        if (!isWorkspaceLoaded()) {
            return CoverageComparisonResult.failure(ErrorCode.NO_WORKSPACE, NO_WORKSPACE_MESSAGE);
        }
        if (baseline == null || !baseline.isSuccess() || baseline.getSummary() == null) {
            return comparator.compare(baseline, null);
        }
        try {
            return comparator.compare(baseline, runCoverageAnalysis(options));
        } catch (RuntimeException e) {
            log.error("Coverage comparison failed", e);
            return CoverageComparisonResult.failure(ErrorCode.COMPARISON_FAILED,
                    ErrorCode.COMPARISON_FAILED.getDescription() + ": " + e.getMessage());
        }
    }

    private static boolean classMatches(String reportedName, String requested) {
        if (reportedName.equalsIgnoreCase(requested)) {
            return true;
        }
        // Nested classes are reported as Outer/Inner
        String simple = reportedName.substring(Math.max(reportedName.lastIndexOf('.'), reportedName.lastIndexOf('/')) + 1);
        return simple.toLowerCase(Locale.ROOT).equals(requested.toLowerCase(Locale.ROOT));
    }

    private static void removeExcludedFiles(ProjectCoverage project, List<String> excludedFiles) {
        if (excludedFiles.isEmpty()) {
            return;
        }
        project.getFiles().removeIf(f -> PathPatterns.matchesAny(f.getFilePath(), excludedFiles));
        project.getClasses().removeIf(c -> PathPatterns.matchesAny(c.getFilePath(), excludedFiles));
        if (log.isDebugEnabled()) {
            log.debug("Project {} keeps {} file(s) after exclusions: {}", project.getProjectName(),
                    project.getFiles().size(),
                    project.getFiles().stream().map(FileCoverage::getFilePath).collect(Collectors.joining(", ")));
        }
    }

    private static String describeFailures(List<TestProjectRun> failed) {
        if (failed.isEmpty()) {
            return "";
        }
        return failed.stream()
                .map(r -> r.getProjectName() + ": " + r.getErrorMessage())
                .collect(Collectors.joining("; ", " ", ""));
    }
}
