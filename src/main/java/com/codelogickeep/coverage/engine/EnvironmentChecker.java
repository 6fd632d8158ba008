package com.codelogickeep.coverage.engine;

import com.codelogickeep.coverage.config.AppConfig;
import com.codelogickeep.coverage.workspace.DescriptorWorkspaceLoader;
import com.codelogickeep.coverage.workspace.Workspace;
import com.codelogickeep.coverage.workspace.WorkspaceProject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Checks that coverage analysis can run: test runner available, workspace readable,
 * test projects found and their directories writable.
 */
public class EnvironmentChecker {
    private static final Logger log = LoggerFactory.getLogger(EnvironmentChecker.class);

    private EnvironmentChecker() {
    }

    /**
     * Runs all checks and prints a report.
     *
     * @param workspacePath workspace to audit, or null to check the toolchain only
     * @return true when analysis can run
     */
    public static boolean check(AppConfig config, Path workspacePath, PrintStream out) {
        out.println("\n>>> Starting Environment Check...\n");
        out.println("Test Runner:  " + config.getToolchain().getExecutable());
        out.println("Report File:  " + config.getRunner().getReportFileName());
        if (workspacePath != null) {
            out.println("Workspace:    " + workspacePath.toAbsolutePath());
        }
        out.println();

        boolean runnerOk = checkTestRunner(TestToolchain.locate(config.getToolchain()), out);
        boolean workspaceOk = workspacePath == null || auditWorkspace(config, workspacePath, out);

        out.println("\n>>> Environment Check Summary:");
        out.println("Test Runner: " + (runnerOk ? "OK" : "FAILED"));
        if (workspacePath != null) {
            out.println("Workspace:   " + (workspaceOk ? "OK" : "FAILED"));
        }

        if (!runnerOk) {
            out.println("\n>>> CRITICAL: test runner '" + config.getToolchain().getExecutable() + "' is not usable.");
            out.println("    Install it or set toolchain.executable in coverage-analyzer.yml.");
            return false;
        }
        if (!workspaceOk) {
            out.println("\n>>> Please fix the workspace issues above before running the analysis.");
            return false;
        }
        out.println("\n>>> Environment is ready!");
        return true;
    }

    static boolean checkTestRunner(TestToolchain toolchain, PrintStream out) {
        out.print("Checking test runner... ");
        if (!toolchain.isAvailable()) {
            out.println("FAILED (" + toolchain.getExecutable() + " not found on the PATH)");
            return false;
        }
        Optional<String> version = toolchain.probeVersion();
        if (version.isPresent()) {
            out.println("OK (" + toolchain.getExecutable() + " " + version.get() + ")");
            return true;
        }
        out.println("FAILED (" + toolchain.getExecutable() + " did not report a version)");
        return false;
    }

    private static boolean auditWorkspace(AppConfig config, Path workspacePath, PrintStream out) {
        out.println("Checking workspace... ");
        Workspace workspace;
        try {
            workspace = new DescriptorWorkspaceLoader(config.getDiscovery()).load(workspacePath);
        } catch (IOException e) {
            out.println("  FAILED (" + e.getMessage() + ")");
            return false;
        }

        TestProjectClassifier classifier = new TestProjectClassifier(config.getDiscovery());
        int testProjects = 0;
        boolean allWritable = true;
        for (WorkspaceProject project : workspace.projects()) {
            TestProjectClassification classification = classifier.classify(project);
            out.println("  " + project.name() + ": " + classification);
            if (classification.isTestProject()) {
                testProjects++;
                if (!isWritable(project.directory())) {
                    out.println("    Cannot write to " + project.directory());
                    allWritable = false;
                }
            }
        }
        out.println("  Projects: " + workspace.projects().size() + ", test projects: " + testProjects);
        if (testProjects == 0) {
            out.println("  FAILED (no test projects found)");
            return false;
        }
        return allWritable;
    }

    private static boolean isWritable(Path directory) {
        try {
            Path probe = Files.createTempFile(directory, ".coverage-check", ".tmp");
            Files.delete(probe);
            return true;
        } catch (IOException e) {
            log.debug("Directory {} is not writable: {}", directory, e.getMessage());
            return false;
        }
    }
}
