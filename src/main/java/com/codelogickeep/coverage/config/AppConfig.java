package com.codelogickeep.coverage.config;

import com.codelogickeep.coverage.model.CoverageAnalysisOptions;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class AppConfig {
    private ToolchainConfig toolchain = new ToolchainConfig();
    private DiscoveryConfig discovery = new DiscoveryConfig();
    private RunnerConfig runner = new RunnerConfig();
    private CoverageAnalysisOptions defaults = CoverageAnalysisOptions.defaults();

    @Data
    public static class ToolchainConfig {
        /** Test runner executable, a name looked up on the PATH or an absolute path */
        private String executable = "dotnet";

        /**
         * Arguments of one test invocation. Placeholders: {project} (descriptor file),
         * {projectDir}, {resultsDir}.
         */
        private List<String> arguments = new ArrayList<>(List.of(
                "test", "{project}",
                "--collect", "XPlat Code Coverage",
                "--results-directory", "{resultsDir}",
                "--verbosity", "normal"));

        /** Appended when a test filter is given. Placeholder: {filter} */
        @JsonProperty("filter-arguments")
        private List<String> filterArguments = new ArrayList<>(List.of("--filter", "{filter}"));

        @JsonProperty("version-arguments")
        private List<String> versionArguments = new ArrayList<>(List.of("--version"));
    }

    @Data
    public static class DiscoveryConfig {
        /** File name globs of project descriptors */
        @JsonProperty("descriptor-patterns")
        private List<String> descriptorPatterns = new ArrayList<>(List.of("*.csproj", "pom.xml"));

        /** Dependency id prefixes that identify a test framework (case-insensitive) */
        @JsonProperty("test-framework-markers")
        private List<String> testFrameworkMarkers = new ArrayList<>(List.of(
                "Microsoft.NET.Test.Sdk", "xunit", "NUnit", "MSTest", "junit", "testng"));

        /** Project names matching this regex are test projects */
        @JsonProperty("test-name-pattern")
        private String testNamePattern = "(?i).*test.*";

        @JsonProperty("ignored-directories")
        private List<String> ignoredDirectories = new ArrayList<>(List.of(
                "bin", "obj", "target", "node_modules", ".git", ".idea", ".vs", "TestResults"));

        @JsonProperty("max-depth")
        private int maxDepth = 8;
    }

    @Data
    public static class RunnerConfig {
        /** Upper bound of concurrent test processes; 0 means one per project */
        @JsonProperty("max-parallelism")
        private int maxParallelism = 0;

        /** Directory created under each test project to receive coverage output */
        @JsonProperty("results-directory")
        private String resultsDirectory = "TestResults";

        @JsonProperty("report-file-name")
        private String reportFileName = "coverage.cobertura.xml";
    }
}
