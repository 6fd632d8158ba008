package com.codelogickeep.coverage.engine;

import com.codelogickeep.coverage.config.AppConfig;
import com.codelogickeep.coverage.workspace.WorkspaceProject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * The external test runner executable and the command line used to run one test project
 * under coverage. Created once per process by {@link #locate(AppConfig.ToolchainConfig)}.
 */
public class TestToolchain {
    private static final Logger log = LoggerFactory.getLogger(TestToolchain.class);

    private static final String[] WINDOWS_EXTENSIONS = {".exe", ".cmd", ".bat"};

    private final String executable;
    private final boolean available;
    private final AppConfig.ToolchainConfig config;

    TestToolchain(String executable, boolean available, AppConfig.ToolchainConfig config) {
        this.executable = executable;
        this.available = available;
        this.config = config;
    }

    /**
     * Resolves the configured executable against the PATH. A toolchain is returned even when
     * the executable is not found, so that each test run reports the launch failure itself.
     */
    public static TestToolchain locate(AppConfig.ToolchainConfig config) {
        String name = config.getExecutable();
        Optional<Path> resolved = resolveExecutable(name, System.getenv("PATH"));
        if (resolved.isPresent()) {
            log.info("Using test runner: {}", resolved.get());
            return new TestToolchain(resolved.get().toString(), true, config);
        }
        log.warn("Test runner '{}' not found on the PATH; test runs will fail to launch", name);
        return new TestToolchain(name, false, config);
    }

    static Optional<Path> resolveExecutable(String name, String pathVariable) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        try {
            Path direct = Paths.get(name);
            if (direct.isAbsolute() || name.contains("/") || name.contains(File.separator)) {
                return Files.isExecutable(direct) ? Optional.of(direct.toAbsolutePath()) : Optional.empty();
            }
            if (pathVariable == null) {
                return Optional.empty();
            }
            boolean isWindows = System.getProperty("os.name").toLowerCase(Locale.ROOT).contains("win");
            for (String dir : pathVariable.split(File.pathSeparator)) {
                if (dir.isBlank()) {
                    continue;
                }
                Path candidate = Paths.get(dir).resolve(name);
                if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                    return Optional.of(candidate);
                }
                if (isWindows) {
                    for (String ext : WINDOWS_EXTENSIONS) {
                        Path withExt = Paths.get(dir).resolve(name + ext);
                        if (Files.isRegularFile(withExt)) {
                            return Optional.of(withExt);
                        }
                    }
                }
            }
        } catch (InvalidPathException e) {
            log.debug("Invalid path entry while resolving {}: {}", name, e.getMessage());
        }
        return Optional.empty();
    }

    /**
     * Builds the command line for one test project.
     *
     * @param testFilter appended through the configured filter arguments when not blank
     */
    public List<String> buildCommand(WorkspaceProject project, Path resultsDirectory, String testFilter) {
        List<String> command = new ArrayList<>();
        command.add(executable);
        for (String argument : config.getArguments()) {
            command.add(substitute(argument, project, resultsDirectory, testFilter));
        }
        if (testFilter != null && !testFilter.isBlank() && config.getFilterArguments() != null) {
            for (String argument : config.getFilterArguments()) {
                command.add(substitute(argument, project, resultsDirectory, testFilter));
            }
        }
        return command;
    }

    private static String substitute(String argument, WorkspaceProject project, Path resultsDirectory, String testFilter) {
        return argument
                .replace("{project}", project.descriptorPath().toAbsolutePath().toString())
                .replace("{projectDir}", project.directory().toString())
                .replace("{resultsDir}", resultsDirectory.toAbsolutePath().toString())
                .replace("{filter}", testFilter != null ? testFilter : "");
    }

    /**
     * Runs the executable with its version arguments, e.g. {@code dotnet --version}.
     *
     * @return the first output line, or empty when the tool is missing, fails or hangs
     */
    public Optional<String> probeVersion() {
        List<String> command = new ArrayList<>();
        command.add(executable);
        command.addAll(config.getVersionArguments());
        try {
            ProcessBuilder pb = new ProcessBuilder(command);
            pb.redirectErrorStream(true);
            Process process = pb.start();
            boolean finished = process.waitFor(10, TimeUnit.SECONDS);
            if (!finished) {
                process.destroyForcibly();
                log.warn("'{}' did not answer within 10 seconds", String.join(" ", command));
                return Optional.empty();
            }
            if (process.exitValue() != 0) {
                log.warn("'{}' exited with code {}", String.join(" ", command), process.exitValue());
                return Optional.empty();
            }
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line = reader.readLine();
                return Optional.ofNullable(line).map(String::trim);
            }
        } catch (IOException e) {
            log.warn("Failed to run '{}': {}", String.join(" ", command), e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    public String getExecutable() {
        return executable;
    }

    public boolean isAvailable() {
        return available;
    }
}
