package com.codelogickeep.coverage;

import com.codelogickeep.coverage.model.CoverageAnalysisOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("App Tests")
class AppTest {

    private static final CoverageAnalysisOptions CONFIGURED = CoverageAnalysisOptions.builder()
            .excludedProject("Legacy")
            .includedProject("Configured")
            .timeoutMinutes(20)
            .build();

    @Test
    @DisplayName("command line options should override configured defaults")
    void commandLineShouldOverrideDefaults() {
        App.RunCommand command = new App.RunCommand();
        new CommandLine(command).parseArgs(
                "--include", "Calc,Web",
                "--exclude-files", "glob:**/obj/**",
                "--timeout", "5",
                "--sequential",
                "--no-branches",
                "--filter", "Category=Unit");

        CoverageAnalysisOptions options = command.analysis.toOptions(CONFIGURED);

        assertEquals(List.of("Calc", "Web"), options.getIncludedProjects());
        assertEquals(List.of("Legacy"), options.getExcludedProjects());
        assertEquals(List.of("glob:**/obj/**"), options.getExcludedFiles());
        assertEquals(5, options.getTimeoutMinutes());
        assertFalse(options.isRunInParallel());
        assertFalse(options.isCollectBranchCoverage());
        assertTrue(options.isCollectMethodCoverage());
        assertEquals("Category=Unit", options.getTestFilter());
    }

    @Test
    @DisplayName("configured defaults should apply without options")
    void defaultsShouldApplyWithoutOptions() {
        App.SummaryCommand command = new App.SummaryCommand();
        new CommandLine(command).parseArgs();

        assertEquals(CONFIGURED, command.analysis.toOptions(CONFIGURED));
        assertEquals(".", command.analysis.workspace.getPath());
    }

    @Test
    @DisplayName("method command should take class and method names")
    void methodCommandShouldTakeNames() {
        App.MethodCommand command = new App.MethodCommand();
        new CommandLine(command).parseArgs("Calculator", "Add", "-w", "/tmp/ws");

        assertEquals("Calculator", command.className);
        assertEquals("Add", command.methodName);
    }

    @Test
    @DisplayName("invalid usage should exit with the usage code")
    void invalidUsageShouldExitWithUsageCode() {
        CommandLine cli = new CommandLine(new App());
        cli.setErr(new PrintWriter(new StringWriter()));

        assertEquals(App.EXIT_USAGE, cli.execute("compare"));
        assertEquals(App.EXIT_USAGE, cli.execute("method", "OnlyClass"));
        assertEquals(App.EXIT_USAGE, cli.execute("run", "--timeout", "soon"));
    }
}
