package com.codelogickeep.coverage.engine;

import com.codelogickeep.coverage.config.AppConfig;
import com.codelogickeep.coverage.exception.CoverageAnalysisException.ErrorCode;
import com.codelogickeep.coverage.model.CoverageAnalysisOptions;
import com.codelogickeep.coverage.model.TestExecutionSummary;
import com.codelogickeep.coverage.model.TestProjectRun;
import com.codelogickeep.coverage.parser.TestResultParser;
import com.codelogickeep.coverage.workspace.WorkspaceProject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Runs test projects under coverage, one external process per project.
 * <p>
 * Every run is bounded by its own timeout and reports its outcome as a {@link TestProjectRun};
 * a failing, hanging or missing process never affects the other runs and never throws.
 * {@link #cancel()} keeps queued projects from starting and destroys every process still running.
 */
public class TestRunner {
    private static final Logger log = LoggerFactory.getLogger(TestRunner.class);

    private static final long STREAM_DRAIN_TIMEOUT_MS = 10_000;
    private static final long GRACEFUL_STOP_SECONDS = 5;

    private final TestToolchain toolchain;
    private final AppConfig.RunnerConfig config;
    private final TestResultParser testResultParser;

    private final Set<Process> liveProcesses = ConcurrentHashMap.newKeySet();
    private final Set<Future<TestProjectRun>> pendingRuns = ConcurrentHashMap.newKeySet();
    private volatile boolean cancelled;

    public TestRunner(TestToolchain toolchain, AppConfig.RunnerConfig config, TestResultParser testResultParser) {
        this.toolchain = toolchain;
        this.config = config;
        this.testResultParser = testResultParser;
    }

    /**
     * Runs every project and returns one run per project. Under parallel execution the
     * order of the returned runs follows the input order but completion order is unspecified.
     */
    public List<TestProjectRun> runAll(List<WorkspaceProject> projects, CoverageAnalysisOptions options) {
        return runAll(projects, options, Duration.ofMinutes(options.getTimeoutMinutes()));
    }

    List<TestProjectRun> runAll(List<WorkspaceProject> projects, CoverageAnalysisOptions options, Duration timeout) {
        if (projects == null || projects.isEmpty()) {
            return new ArrayList<>();
        }
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("Timeout must be positive: " + timeout);
        }

        if (!options.isRunInParallel() || projects.size() == 1) {
            return runSequentially(projects, options, timeout);
        }
        return runInParallel(projects, options, timeout);
    }

    private List<TestProjectRun> runSequentially(List<WorkspaceProject> projects, CoverageAnalysisOptions options, Duration timeout) {
        List<TestProjectRun> runs = new ArrayList<>();
        for (WorkspaceProject project : projects) {
            if (cancelled || Thread.currentThread().isInterrupted()) {
                runs.add(cancelledRun(project));
                continue;
            }
            runs.add(runProject(project, options, timeout));
        }
        return runs;
    }

    private List<TestProjectRun> runInParallel(List<WorkspaceProject> projects, CoverageAnalysisOptions options, Duration timeout) {
        int threads = config.getMaxParallelism() > 0
                ? Math.min(config.getMaxParallelism(), projects.size())
                : projects.size();
        log.info("Running {} test project(s) on {} thread(s)", projects.size(), threads);

        ExecutorService executor = Executors.newFixedThreadPool(threads, new RunnerThreadFactory());
        List<Future<TestProjectRun>> futures = new ArrayList<>();
        try {
            for (WorkspaceProject project : projects) {
                Future<TestProjectRun> future = executor.submit(() -> runProject(project, options, timeout));
                futures.add(future);
                pendingRuns.add(future);
            }
            if (cancelled) {
                futures.forEach(f -> f.cancel(false));
            }

            List<TestProjectRun> runs = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                WorkspaceProject project = projects.get(i);
                try {
                    runs.add(futures.get(i).get());
                } catch (CancellationException e) {
                    runs.add(cancelledRun(project));
                } catch (InterruptedException e) {
                    log.warn("Interrupted while waiting for test runs, cancelling");
                    Thread.currentThread().interrupt();
                    cancel();
                    futures.forEach(f -> f.cancel(true));
                    for (int j = i; j < projects.size(); j++) {
                        runs.add(cancelledRun(projects.get(j)));
                    }
                    break;
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    log.error("Test run of {} failed unexpectedly", project.name(), cause);
                    TestProjectRun run = baseRun(project);
                    run.fail(ErrorCode.UNKNOWN_ERROR, "Test run failed unexpectedly: " + cause.getMessage());
                    runs.add(run);
                }
            }
            return runs;
        } finally {
            pendingRuns.removeAll(futures);
            executor.shutdownNow();
            try {
                if (!executor.awaitTermination(GRACEFUL_STOP_SECONDS, TimeUnit.SECONDS)) {
                    log.warn("Test runner threads did not terminate in time");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Cancels the current runs: projects not yet started finish as cancelled without launching
     * a process, and every test process still running is destroyed. The flag stays set until
     * {@link #resetCancellation()}, so a cancel issued before {@code runAll} is not lost.
     */
    public void cancel() {
        cancelled = true;
        for (Future<TestProjectRun> future : pendingRuns) {
            future.cancel(false);
        }
        for (Process process : liveProcesses) {
            destroyTree(process);
        }
    }

    /** Clears a previous {@link #cancel()} before a new analysis starts. */
    public void resetCancellation() {
        cancelled = false;
    }

    /**
     * Runs one test project. Never throws.
     */
    TestProjectRun runProject(WorkspaceProject project, CoverageAnalysisOptions options, Duration timeout) {
        if (cancelled) {
            log.info("Test project {} not started: cancelled", project.name());
            return cancelledRun(project);
        }
        long start = System.nanoTime();
        TestProjectRun run = baseRun(project);
        try {
            execute(project, options, timeout, run);
        } finally {
            run.setDuration(Duration.ofNanos(System.nanoTime() - start));
        }
        if (run.isSuccess()) {
            log.info("Test project {} finished in {} ms", project.name(), run.getDuration().toMillis());
        } else {
            log.warn("Test project {} failed: {}", project.name(), run.getErrorMessage());
        }
        return run;
    }

    private void execute(WorkspaceProject project, CoverageAnalysisOptions options, Duration timeout, TestProjectRun run) {
        Path resultsDirectory = project.directory().resolve(config.getResultsDirectory());
        try {
            clearDirectory(resultsDirectory);
            Files.createDirectories(resultsDirectory);
        } catch (IOException e) {
            run.fail(ErrorCode.PROCESS_LAUNCH_FAILED, "Cannot prepare results directory " + resultsDirectory + ": " + e.getMessage());
            return;
        }

        List<String> command = toolchain.buildCommand(project, resultsDirectory, options.getTestFilter());
        log.debug("Executing in {}: {}", project.directory(), command);

        Process process;
        try {
            ProcessBuilder pb = new ProcessBuilder(command);
            pb.directory(project.directory().toFile());
            process = pb.start();
        } catch (IOException e) {
            run.fail(ErrorCode.PROCESS_LAUNCH_FAILED, "Failed to start test process '" + toolchain.getExecutable() + "': " + e.getMessage());
            return;
        }

        liveProcesses.add(process);
        // cancel() may have run between start() and add()
        if (cancelled) {
            destroyTree(process);
        }
        List<String> outputLines = Collections.synchronizedList(new ArrayList<>());
        List<String> errorLines = Collections.synchronizedList(new ArrayList<>());
        Thread outThread = startReader(process.getInputStream(), outputLines, project.name() + "-stdout");
        Thread errThread = startReader(process.getErrorStream(), errorLines, project.name() + "-stderr");

        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                destroyTree(process);
                drain(outThread, errThread);
                run.setOutputLines(snapshot(outputLines));
                run.setErrorLines(snapshot(errorLines));
                run.fail(ErrorCode.PROCESS_TIMEOUT, "Test execution timed out after " + describe(timeout));
                return;
            }
            drain(outThread, errThread);
        } catch (InterruptedException e) {
            destroyTree(process);
            Thread.currentThread().interrupt();
            run.fail(ErrorCode.PROCESS_CANCELLED, "Test execution was cancelled");
            return;
        } finally {
            liveProcesses.remove(process);
        }

        run.setOutputLines(snapshot(outputLines));
        run.setErrorLines(snapshot(errorLines));
        if (cancelled) {
            run.fail(ErrorCode.PROCESS_CANCELLED, "Test execution was cancelled");
            return;
        }

        int exitCode = process.exitValue();
        run.setExitCode(exitCode);

        List<String> transcript = new ArrayList<>(run.getOutputLines());
        transcript.addAll(run.getErrorLines());
        TestExecutionSummary summary = testResultParser.parseTestResults(transcript);
        run.setTestSummary(summary);

        Optional<Path> report = locateReport(resultsDirectory);
        report.ifPresent(p -> run.setCoverageReportPath(p.toString()));

        if (exitCode == 0) {
            run.setSuccess(true);
        } else if (summary.getTotalTests() > 0 && report.isPresent()) {
            log.info("Test project {} has {} failing test(s)", project.name(), summary.getFailedTests());
            run.setSuccess(true);
        } else {
            String detail = run.getErrorLines().isEmpty() ? "" : ": " + run.getErrorLines().get(0);
            run.fail(ErrorCode.PROCESS_LAUNCH_FAILED, "Test process exited with code " + exitCode + detail);
        }
    }

    /**
     * Finds the coverage report below the results directory: the configured file name first
     * (newest wins), otherwise any XML file whose name contains "coverage".
     */
    Optional<Path> locateReport(Path resultsDirectory) {
        if (!Files.isDirectory(resultsDirectory)) {
            return Optional.empty();
        }
        try (Stream<Path> stream = Files.walk(resultsDirectory)) {
            List<Path> xmlFiles = stream
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".xml"))
                    .collect(Collectors.toList());

            Optional<Path> named = xmlFiles.stream()
                    .filter(p -> p.getFileName().toString().equals(config.getReportFileName()))
                    .max(Comparator.comparingLong(TestRunner::lastModified));
            if (named.isPresent()) {
                return named;
            }
            return xmlFiles.stream()
                    .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).contains("coverage"))
                    .max(Comparator.comparingLong(TestRunner::lastModified));
        } catch (IOException e) {
            log.warn("Failed to search {} for coverage reports: {}", resultsDirectory, e.getMessage());
            return Optional.empty();
        }
    }

    private TestProjectRun baseRun(WorkspaceProject project) {
        return TestProjectRun.builder()
                .projectName(project.name())
                .projectPath(project.path())
                .exitCode(-1)
                .duration(Duration.ZERO)
                .outputLines(new ArrayList<>())
                .errorLines(new ArrayList<>())
                .build();
    }

    private TestProjectRun cancelledRun(WorkspaceProject project) {
        TestProjectRun run = baseRun(project);
        run.fail(ErrorCode.PROCESS_CANCELLED, "Test execution was cancelled");
        return run;
    }

    private static void destroyTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroy();
        try {
            if (!process.waitFor(GRACEFUL_STOP_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
        }
    }

    private static Thread startReader(InputStream stream, List<String> sink, String name) {
        Thread thread = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    sink.add(line);
                }
            } catch (IOException e) {
                log.debug("Stream {} closed: {}", name, e.getMessage());
            }
        }, name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    // Grandchildren may keep the pipes open after the process exits
    private static void drain(Thread... readers) throws InterruptedException {
        for (Thread reader : readers) {
            reader.join(STREAM_DRAIN_TIMEOUT_MS);
        }
    }

    private static List<String> snapshot(List<String> lines) {
        synchronized (lines) {
            return new ArrayList<>(lines);
        }
    }

    private static void clearDirectory(Path directory) throws IOException {
        if (!Files.exists(directory)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(directory)) {
            List<Path> paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
            for (Path path : paths) {
                Files.deleteIfExists(path);
            }
        }
    }

    private static long lastModified(Path path) {
        try {
            return Files.getLastModifiedTime(path).toMillis();
        } catch (IOException e) {
            return 0L;
        }
    }

    static String describe(Duration timeout) {
        long seconds = timeout.getSeconds();
        if (seconds >= 60 && seconds % 60 == 0) {
            long minutes = seconds / 60;
            return minutes + (minutes == 1 ? " minute" : " minutes");
        }
        if (timeout.toMillis() % 1000 == 0) {
            return seconds + (seconds == 1 ? " second" : " seconds");
        }
        return timeout.toMillis() + " ms";
    }

    private static final class RunnerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "coverage-test-runner-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
