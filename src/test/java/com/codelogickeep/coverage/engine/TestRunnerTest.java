package com.codelogickeep.coverage.engine;

import com.codelogickeep.coverage.config.AppConfig;
import com.codelogickeep.coverage.exception.CoverageAnalysisException.ErrorCode;
import com.codelogickeep.coverage.model.CoverageAnalysisOptions;
import com.codelogickeep.coverage.model.TestProjectRun;
import com.codelogickeep.coverage.parser.TestResultParser;
import com.codelogickeep.coverage.workspace.WorkspaceProject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs real processes through {@code sh -c} in place of the test toolchain.
 */
@DisplayName("TestRunner Tests")
@EnabledOnOs({OS.LINUX, OS.MAC})
class TestRunnerTest {

    private static final String REPORT = "<coverage line-rate=\"1\" branch-rate=\"1\"><packages/></coverage>";

    @TempDir
    Path workspace;

    private AppConfig.RunnerConfig runnerConfig;

    @BeforeEach
    void setUp() {
        runnerConfig = new AppConfig.RunnerConfig();
    }

    private WorkspaceProject project(String name) throws IOException {
        Path dir = Files.createDirectories(workspace.resolve(name));
        return new WorkspaceProject(name, dir.resolve(name + ".csproj"), Set.of("xunit"), false, List.of(), null);
    }

    private TestRunner runnerFor(String script) {
        AppConfig.ToolchainConfig toolchainConfig = new AppConfig.ToolchainConfig();
        toolchainConfig.setExecutable("sh");
        toolchainConfig.setArguments(List.of("-c", script));
        TestToolchain toolchain = new TestToolchain("sh", true, toolchainConfig);
        return new TestRunner(toolchain, runnerConfig, new TestResultParser());
    }

    private static String writeReport() {
        return "mkdir -p '{resultsDir}/run1' && printf '%s' '" + REPORT + "' > '{resultsDir}/run1/coverage.cobertura.xml'";
    }

    @Nested
    @DisplayName("runProject")
    class RunProject {

        @Test
        @DisplayName("should succeed and locate the report on a clean exit")
        void shouldSucceedOnCleanExit() throws IOException {
            TestRunner runner = runnerFor(writeReport()
                    + " && echo 'Passed!  - Failed:     0, Passed:     3, Skipped:     0, Total:     3, Duration: 1 s - Calc.Tests.dll'");

            TestProjectRun run = runner.runProject(project("Calc.Tests"), CoverageAnalysisOptions.defaults(), Duration.ofSeconds(30));

            assertTrue(run.isSuccess(), run.getErrorMessage());
            assertEquals(0, run.getExitCode());
            assertEquals(3, run.getTestSummary().getTotalTests());
            assertEquals(3, run.getTestSummary().getPassedTests());
            assertNotNull(run.getCoverageReportPath());
            assertTrue(run.getCoverageReportPath().endsWith("coverage.cobertura.xml"));
            assertFalse(run.getOutputLines().isEmpty());
        }

        @Test
        @DisplayName("should treat failing tests with a report as a completed run")
        void shouldAcceptFailingTestsWithReport() throws IOException {
            TestRunner runner = runnerFor(writeReport()
                    + " && echo 'Total: 4, Passed: 3, Failed: 1, Skipped: 0 - 00:00:02.000' && exit 1");

            TestProjectRun run = runner.runProject(project("Calc.Tests"), CoverageAnalysisOptions.defaults(), Duration.ofSeconds(30));

            assertTrue(run.isSuccess());
            assertEquals(1, run.getExitCode());
            assertEquals(1, run.getTestSummary().getFailedTests());
            assertFalse(run.getTestSummary().isAllTestsPassed());
        }

        @Test
        @DisplayName("should fail with the exit code and first stderr line")
        void shouldFailOnNonZeroExit() throws IOException {
            TestRunner runner = runnerFor("echo 'error MSB1009: Project file does not exist.' >&2; exit 3");

            TestProjectRun run = runner.runProject(project("Calc.Tests"), CoverageAnalysisOptions.defaults(), Duration.ofSeconds(30));

            assertFalse(run.isSuccess());
            assertEquals(ErrorCode.PROCESS_LAUNCH_FAILED, run.getErrorCode());
            assertEquals(3, run.getExitCode());
            assertEquals("Test process exited with code 3: error MSB1009: Project file does not exist.", run.getErrorMessage());
            assertNull(run.getCoverageReportPath());
        }

        @Test
        @DisplayName("should stop a hanging process at the timeout")
        @Timeout(30)
        void shouldTimeOut() throws IOException {
            TestRunner runner = runnerFor("sleep 20");

            TestProjectRun run = runner.runProject(project("Slow.Tests"), CoverageAnalysisOptions.defaults(), Duration.ofMillis(300));

            assertFalse(run.isSuccess());
            assertEquals(ErrorCode.PROCESS_TIMEOUT, run.getErrorCode());
            assertTrue(run.getErrorMessage().contains("timed out"));
            assertEquals("Test execution timed out after 300 ms", run.getErrorMessage());
            assertEquals(-1, run.getExitCode());
        }

        @Test
        @DisplayName("should report a missing executable as a launch failure")
        void shouldReportMissingExecutable() throws IOException {
            AppConfig.ToolchainConfig toolchainConfig = new AppConfig.ToolchainConfig();
            TestToolchain missing = new TestToolchain(workspace.resolve("no-such-runner").toString(), false, toolchainConfig);
            TestRunner runner = new TestRunner(missing, runnerConfig, new TestResultParser());

            TestProjectRun run = runner.runProject(project("Calc.Tests"), CoverageAnalysisOptions.defaults(), Duration.ofSeconds(5));

            assertFalse(run.isSuccess());
            assertEquals(ErrorCode.PROCESS_LAUNCH_FAILED, run.getErrorCode());
            assertTrue(run.getErrorMessage().startsWith("Failed to start test process"));
        }

        @Test
        @DisplayName("should clear reports left by a previous run")
        void shouldClearPreviousResults() throws IOException {
            WorkspaceProject project = project("Calc.Tests");
            Path stale = project.directory().resolve("TestResults/old/coverage.cobertura.xml");
            Files.createDirectories(stale.getParent());
            Files.writeString(stale, REPORT);

            TestProjectRun run = runnerFor("exit 0").runProject(project, CoverageAnalysisOptions.defaults(), Duration.ofSeconds(30));

            assertTrue(run.isSuccess());
            assertNull(run.getCoverageReportPath());
            assertFalse(Files.exists(stale));
        }
    }

    @Nested
    @DisplayName("runAll")
    class RunAll {

        @Test
        @DisplayName("should return runs in input order when running in parallel")
        void shouldKeepInputOrder() throws IOException {
            TestRunner runner = runnerFor(writeReport());
            List<WorkspaceProject> projects = List.of(project("B.Tests"), project("A.Tests"), project("C.Tests"));

            List<TestProjectRun> runs = runner.runAll(projects, CoverageAnalysisOptions.defaults());

            assertEquals(3, runs.size());
            assertEquals("B.Tests", runs.get(0).getProjectName());
            assertEquals("A.Tests", runs.get(1).getProjectName());
            assertEquals("C.Tests", runs.get(2).getProjectName());
            assertTrue(runs.stream().allMatch(TestProjectRun::isSuccess));
        }

        @Test
        @DisplayName("should isolate a failing project from the others")
        void shouldIsolateFailures() throws IOException {
            TestRunner runner = runnerFor("case '{projectDir}' in *Bad.Tests) exit 7;; esac; " + writeReport());
            List<WorkspaceProject> projects = List.of(project("Good.Tests"), project("Bad.Tests"));
            CoverageAnalysisOptions sequential = CoverageAnalysisOptions.builder().runInParallel(false).build();

            List<TestProjectRun> runs = runner.runAll(projects, sequential);

            assertTrue(runs.get(0).isSuccess());
            assertFalse(runs.get(1).isSuccess());
            assertEquals(7, runs.get(1).getExitCode());
        }

        @Test
        @DisplayName("should return no runs for no projects")
        void shouldHandleEmptyInput() {
            assertTrue(runnerFor("exit 0").runAll(List.of(), CoverageAnalysisOptions.defaults()).isEmpty());
        }

        @Test
        @DisplayName("should end running processes on cancel")
        @Timeout(30)
        void shouldCancelRunningProcesses() throws Exception {
            TestRunner runner = runnerFor("sleep 20");
            WorkspaceProject project = project("Slow.Tests");
            AtomicReference<List<TestProjectRun>> result = new AtomicReference<>();

            Thread worker = new Thread(() -> result.set(runner.runAll(List.of(project), CoverageAnalysisOptions.defaults())));
            worker.start();
            Thread.sleep(1000);
            runner.cancel();
            worker.join(25_000);

            assertNotNull(result.get());
            assertEquals(ErrorCode.PROCESS_CANCELLED, result.get().get(0).getErrorCode());
        }
    }

    @Nested
    @DisplayName("runAll in parallel")
    class RunAllInParallel {

        @Test
        @DisplayName("should time out a hanging project while its sibling succeeds")
        @Timeout(30)
        void shouldIsolateTimeoutFromSibling() throws IOException {
            TestRunner runner = runnerFor("case '{projectDir}' in *Hang.Tests) sleep 20;; esac; " + writeReport());
            List<WorkspaceProject> projects = List.of(project("Hang.Tests"), project("Quick.Tests"));

            List<TestProjectRun> runs = runner.runAll(projects, CoverageAnalysisOptions.defaults(), Duration.ofSeconds(3));

            assertEquals(ErrorCode.PROCESS_TIMEOUT, runs.get(0).getErrorCode());
            assertEquals("Test execution timed out after 3 seconds", runs.get(0).getErrorMessage());
            assertTrue(runs.get(1).isSuccess(), runs.get(1).getErrorMessage());
            assertNotNull(runs.get(1).getCoverageReportPath());
        }

        @Test
        @DisplayName("should start the test processes concurrently")
        @Timeout(30)
        void shouldStartProcessesConcurrently() throws IOException {
            String first = workspace.resolve("First.Tests/started").toString();
            String second = workspace.resolve("Second.Tests/started").toString();
            // Each process waits for both marker files, so the runs only succeed when they overlap
            TestRunner runner = runnerFor("touch '{projectDir}/started'; i=0; "
                    + "while [ $i -lt 100 ]; do [ -f '" + first + "' ] && [ -f '" + second + "' ] && break; sleep 0.1; i=$((i+1)); done; "
                    + "[ -f '" + first + "' ] && [ -f '" + second + "' ] && " + writeReport());
            List<WorkspaceProject> projects = List.of(project("First.Tests"), project("Second.Tests"));

            List<TestProjectRun> runs = runner.runAll(projects, CoverageAnalysisOptions.defaults(), Duration.ofSeconds(20));

            assertTrue(runs.get(0).isSuccess(), runs.get(0).getErrorMessage());
            assertTrue(runs.get(1).isSuccess(), runs.get(1).getErrorMessage());
        }

        @Test
        @DisplayName("should not start queued projects after cancel")
        @Timeout(30)
        void shouldNotStartQueuedProjectsAfterCancel() throws Exception {
            runnerConfig.setMaxParallelism(1);
            TestRunner runner = runnerFor("touch '{projectDir}/started'; sleep 20");
            WorkspaceProject running = project("Running.Tests");
            WorkspaceProject queued = project("Queued.Tests");
            AtomicReference<List<TestProjectRun>> result = new AtomicReference<>();

            long start = System.nanoTime();
            Thread worker = new Thread(() -> result.set(
                    runner.runAll(List.of(running, queued), CoverageAnalysisOptions.defaults(), Duration.ofSeconds(20))));
            worker.start();
            Path started = running.directory().resolve("started");
            while (!Files.exists(started)) {
                Thread.sleep(50);
            }
            runner.cancel();
            worker.join(25_000);
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

            assertNotNull(result.get());
            assertEquals(ErrorCode.PROCESS_CANCELLED, result.get().get(0).getErrorCode());
            assertEquals(ErrorCode.PROCESS_CANCELLED, result.get().get(1).getErrorCode());
            assertFalse(Files.exists(queued.directory().resolve("started")));
            assertTrue(elapsed.compareTo(Duration.ofSeconds(15)) < 0, "took " + elapsed);
        }
    }

    @Nested
    @DisplayName("cancellation")
    class Cancellation {

        @Test
        @DisplayName("should keep a cancel issued before the run")
        void shouldKeepEarlyCancel() throws IOException {
            TestRunner runner = runnerFor("touch '{projectDir}/started'");
            WorkspaceProject project = project("Calc.Tests");

            runner.cancel();
            List<TestProjectRun> runs = runner.runAll(List.of(project), CoverageAnalysisOptions.defaults());

            assertEquals(ErrorCode.PROCESS_CANCELLED, runs.get(0).getErrorCode());
            assertFalse(Files.exists(project.directory().resolve("started")));
        }

        @Test
        @DisplayName("should run again after the cancellation is reset")
        void shouldRunAfterReset() throws IOException {
            TestRunner runner = runnerFor(writeReport());
            runner.cancel();
            runner.resetCancellation();

            List<TestProjectRun> runs = runner.runAll(List.of(project("Calc.Tests")), CoverageAnalysisOptions.defaults());

            assertTrue(runs.get(0).isSuccess(), runs.get(0).getErrorMessage());
        }

        @Test
        @DisplayName("should reject a non-positive timeout")
        void shouldRejectNonPositiveTimeout() throws IOException {
            TestRunner runner = runnerFor("exit 0");
            List<WorkspaceProject> projects = List.of(project("Calc.Tests"));

            assertThrows(IllegalArgumentException.class,
                    () -> runner.runAll(projects, CoverageAnalysisOptions.defaults(), Duration.ZERO));
        }
    }

    @Nested
    @DisplayName("locateReport")
    class LocateReport {

        @Test
        @DisplayName("should fall back to any XML file named after coverage")
        void shouldFallBackToCoverageXml() throws IOException {
            Path results = Files.createDirectories(workspace.resolve("results/nested"));
            Files.writeString(results.resolve("junit.xml"), "<testsuite/>");
            Files.writeString(results.resolve("Coverage-report.xml"), REPORT);

            Optional<Path> report = runnerFor("exit 0").locateReport(workspace.resolve("results"));

            assertTrue(report.isPresent());
            assertEquals("Coverage-report.xml", report.get().getFileName().toString());
        }

        @Test
        @DisplayName("should return empty for a missing directory")
        void shouldHandleMissingDirectory() {
            assertTrue(runnerFor("exit 0").locateReport(workspace.resolve("absent")).isEmpty());
        }
    }

    @Test
    @DisplayName("describe should print whole units")
    void describeShouldPrintWholeUnits() {
        assertEquals("10 minutes", TestRunner.describe(Duration.ofMinutes(10)));
        assertEquals("1 minute", TestRunner.describe(Duration.ofMinutes(1)));
        assertEquals("90 seconds", TestRunner.describe(Duration.ofSeconds(90)));
        assertEquals("300 ms", TestRunner.describe(Duration.ofMillis(300)));
    }
}
