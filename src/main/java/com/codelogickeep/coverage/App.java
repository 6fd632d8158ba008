package com.codelogickeep.coverage;

import com.codelogickeep.coverage.config.AppConfig;
import com.codelogickeep.coverage.config.ConfigLoader;
import com.codelogickeep.coverage.engine.CoverageAnalysisEngine;
import com.codelogickeep.coverage.engine.EnvironmentChecker;
import com.codelogickeep.coverage.exception.CoverageAnalysisException;
import com.codelogickeep.coverage.exception.CoverageAnalysisException.ErrorCode;
import com.codelogickeep.coverage.model.CoverageAnalysisOptions;
import com.codelogickeep.coverage.model.CoverageAnalysisResult;
import com.codelogickeep.coverage.model.CoverageComparisonResult;
import com.codelogickeep.coverage.model.CoverageSummary;
import com.codelogickeep.coverage.model.MethodCoverage;
import com.codelogickeep.coverage.model.UncoveredCodeResult;
import com.codelogickeep.coverage.util.JsonUtil;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(name = "coverage-analyzer", mixinStandardHelpOptions = true, version = "1.0.0",
        description = "Runs the test projects of a workspace under code coverage and analyzes the results.",
        subcommands = {
                App.RunCommand.class,
                App.SummaryCommand.class,
                App.UncoveredCommand.class,
                App.MethodCommand.class,
                App.CompareCommand.class,
                App.CheckEnvCommand.class
        })
public class App implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_ANALYSIS_FAILED = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        if (args.length == 0) {
            System.out.println("Workspace Coverage Analyzer: runs tests under coverage and reports what they miss.");
            System.out.println();
            new CommandLine(new App()).usage(System.out);
            System.exit(EXIT_OK);
        }
        int exitCode = new CommandLine(new App()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        new CommandLine(this).usage(System.out);
        return EXIT_OK;
    }

    /**
     * Options shared by every analysis subcommand.
     */
    static class AnalysisOptions {

        @Option(names = {"-w", "--workspace"}, description = "Workspace directory or project descriptor. Default: current directory.")
        File workspace = new File(".");

        @Option(names = {"-c", "--config"}, description = "Path to a configuration file (overrides coverage-analyzer.yml).")
        String configPath;

        @Option(names = {"--include"}, split = ",", description = "Covered projects to report (comma-separated names).")
        List<String> includedProjects;

        @Option(names = {"--exclude"}, split = ",", description = "Projects to leave out of both test runs and results.")
        List<String> excludedProjects;

        @Option(names = {"--include-tests"}, split = ",", description = "Test projects to run (default: all discovered).")
        List<String> includedTestProjects;

        @Option(names = {"--exclude-tests"}, split = ",", description = "Test projects not to run.")
        List<String> excludedTestProjects;

        @Option(names = {"--exclude-files"}, split = ",",
                description = "Source files to leave out of the results: paths, path suffixes or glob: patterns.")
        List<String> excludedFiles;

        @Option(names = {"--timeout"}, description = "Timeout per test project in minutes.")
        Integer timeoutMinutes;

        @Option(names = {"--sequential"}, description = "Run test projects one after another.")
        boolean sequential;

        @Option(names = {"--filter"}, description = "Test filter expression passed to the test runner.")
        String testFilter;

        @Option(names = {"--no-branches"}, description = "Do not collect branch coverage.")
        boolean noBranches;

        @Option(names = {"--no-methods"}, description = "Do not collect method coverage.")
        boolean noMethods;

        @Option(names = {"-o", "--output"}, description = "Write the JSON result to this file instead of standard output.")
        File output;

        AppConfig loadConfig() {
            return new ConfigLoader().load(configPath);
        }

        /** Configured defaults overridden by the command line. */
        CoverageAnalysisOptions toOptions(CoverageAnalysisOptions defaults) {
            CoverageAnalysisOptions.CoverageAnalysisOptionsBuilder builder = defaults.toBuilder();
            if (includedProjects != null) {
                builder.clearIncludedProjects().includedProjects(includedProjects);
            }
            if (excludedProjects != null) {
                builder.clearExcludedProjects().excludedProjects(excludedProjects);
            }
            if (includedTestProjects != null) {
                builder.clearIncludedTestProjects().includedTestProjects(includedTestProjects);
            }
            if (excludedTestProjects != null) {
                builder.clearExcludedTestProjects().excludedTestProjects(excludedTestProjects);
            }
            if (excludedFiles != null) {
                builder.clearExcludedFiles().excludedFiles(excludedFiles);
            }
            if (timeoutMinutes != null) {
                builder.timeoutMinutes(timeoutMinutes);
            }
            if (sequential) {
                builder.runInParallel(false);
            }
            if (testFilter != null) {
                builder.testFilter(testFilter);
            }
            if (noBranches) {
                builder.collectBranchCoverage(false);
            }
            if (noMethods) {
                builder.collectMethodCoverage(false);
            }
            return builder.build();
        }

        void write(Object value) {
            if (output != null) {
                JsonUtil.writeValue(output.toPath(), value);
                System.err.println(">>> Result written to " + output.getAbsolutePath());
            } else {
                System.out.println(JsonUtil.toJson(value));
            }
        }
    }

    /**
     * Loads configuration and workspace, then runs one engine operation.
     */
    abstract static class AnalysisCommand implements Callable<Integer> {

        @Mixin
        AnalysisOptions analysis;

        @Override
        public Integer call() {
            try {
                AppConfig config = analysis.loadConfig();
                CoverageAnalysisOptions options = analysis.toOptions(config.getDefaults());
                if (options.getTimeoutMinutes() <= 0) {
                    System.err.println("Error: --timeout must be a positive number of minutes");
                    return EXIT_USAGE;
                }

                CoverageAnalysisEngine engine = CoverageAnalysisEngine.create(config);
                // Ctrl+C must not leave test processes behind
                Runtime.getRuntime().addShutdownHook(new Thread(engine::cancel, "coverage-analyzer-shutdown"));

                Path workspace = analysis.workspace.toPath();
                System.err.println(">>> Loading workspace: " + workspace.toAbsolutePath());
                if (!engine.loadWorkspace(workspace)) {
                    System.err.println("Error: Failed to load workspace " + workspace.toAbsolutePath());
                    return EXIT_ANALYSIS_FAILED;
                }
                return execute(engine, options);
            } catch (CoverageAnalysisException e) {
                System.err.println(e.toDisplayMessage());
                return EXIT_USAGE;
            }
        }

        abstract int execute(CoverageAnalysisEngine engine, CoverageAnalysisOptions options);
    }

    private static void printFailure(ErrorCode errorCode, String message) {
        String code = errorCode != null ? errorCode.getCode() : ErrorCode.UNKNOWN_ERROR.getCode();
        System.err.println("ERROR [" + code + "]: " + message);
    }

    @Command(name = "run", mixinStandardHelpOptions = true,
            description = "Run the full coverage analysis and print the result as JSON.")
    static class RunCommand extends AnalysisCommand {
        @Override
        int execute(CoverageAnalysisEngine engine, CoverageAnalysisOptions options) {
            CoverageAnalysisResult result = engine.runCoverageAnalysis(options);
            analysis.write(result);
            if (!result.isSuccess()) {
                printFailure(result.getErrorCode(), result.getErrorMessage());
                return EXIT_ANALYSIS_FAILED;
            }
            System.err.println(">>> Line coverage: " + result.getSummary().getLinesCoveredPercentage() + "%");
            return EXIT_OK;
        }
    }

    @Command(name = "summary", mixinStandardHelpOptions = true,
            description = "Print the overall coverage summary.")
    static class SummaryCommand extends AnalysisCommand {
        @Override
        int execute(CoverageAnalysisEngine engine, CoverageAnalysisOptions options) {
            CoverageSummary summary = engine.getCoverageSummary(options);
            analysis.write(summary);
            return summary.getTotalLines() > 0 ? EXIT_OK : EXIT_ANALYSIS_FAILED;
        }
    }

    @Command(name = "uncovered", mixinStandardHelpOptions = true,
            description = "List methods, lines and branches not executed by any test.")
    static class UncoveredCommand extends AnalysisCommand {
        @Override
        int execute(CoverageAnalysisEngine engine, CoverageAnalysisOptions options) {
            UncoveredCodeResult result = engine.findUncoveredCode(options);
            analysis.write(result);
            if (!result.isSuccess()) {
                printFailure(result.getErrorCode(), result.getErrorMessage());
                return EXIT_ANALYSIS_FAILED;
            }
            System.err.println(">>> Uncovered items: " + result.getTotalUncoveredItems());
            return EXIT_OK;
        }
    }

    @Command(name = "method", mixinStandardHelpOptions = true,
            description = "Print the coverage of one method.")
    static class MethodCommand extends AnalysisCommand {
        @Parameters(index = "0", description = "Class name, simple or fully qualified.")
        String className;

        @Parameters(index = "1", description = "Method name.")
        String methodName;

        @Override
        int execute(CoverageAnalysisEngine engine, CoverageAnalysisOptions options) {
            Optional<MethodCoverage> method = engine.getMethodCoverage(className, methodName, options);
            if (method.isEmpty()) {
                System.err.println("Error: Method '" + className + "." + methodName + "' not found in coverage results.");
                return EXIT_ANALYSIS_FAILED;
            }
            analysis.write(method.get());
            return EXIT_OK;
        }
    }

    @Command(name = "compare", mixinStandardHelpOptions = true,
            description = "Run a fresh analysis and compare it with a saved baseline result.")
    static class CompareCommand extends AnalysisCommand {
        @Option(names = {"-b", "--baseline"}, required = true,
                description = "Baseline analysis result, as written by 'run --output'.")
        File baseline;

        @Override
        int execute(CoverageAnalysisEngine engine, CoverageAnalysisOptions options) {
            CoverageAnalysisResult baselineResult = JsonUtil.readValue(baseline.toPath(), CoverageAnalysisResult.class);
            CoverageComparisonResult result = engine.compareCoverage(baselineResult, options);
            analysis.write(result);
            if (!result.isSuccess()) {
                printFailure(result.getErrorCode(), result.getErrorMessage());
                return EXIT_ANALYSIS_FAILED;
            }
            System.err.println(">>> Line coverage change: " + result.getDelta().getLinesCoverageChange() + " points");
            return EXIT_OK;
        }
    }

    @Command(name = "check-env", mixinStandardHelpOptions = true,
            description = "Check that the test runner is installed and the workspace contains test projects.")
    static class CheckEnvCommand implements Callable<Integer> {
        @Option(names = {"-w", "--workspace"}, description = "Workspace directory to audit.")
        File workspace;

        @Option(names = {"-c", "--config"}, description = "Path to a configuration file.")
        String configPath;

        @Override
        public Integer call() {
            try {
                AppConfig config = new ConfigLoader().load(configPath);
                boolean ok = EnvironmentChecker.check(config, workspace != null ? workspace.toPath() : null, System.out);
                return ok ? EXIT_OK : EXIT_ANALYSIS_FAILED;
            } catch (CoverageAnalysisException e) {
                System.err.println(e.toDisplayMessage());
                return EXIT_USAGE;
            }
        }
    }
}
