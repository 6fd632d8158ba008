package com.codelogickeep.coverage.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.junit.jupiter.api.*;

import java.io.InputStream;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * AppConfig parsing and defaults.
 */
@DisplayName("AppConfig Tests")
class AppConfigTest {

    private ObjectMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = new ObjectMapper(new YAMLFactory());
    }

    @Nested
    @DisplayName("Basic Parsing")
    class BasicParsing {

        @Test
        @DisplayName("should parse empty YAML to default config")
        void shouldParseEmptyYaml() throws Exception {
            AppConfig config = mapper.readValue("{}", AppConfig.class);

            assertEquals("dotnet", config.getToolchain().getExecutable());
            assertEquals(List.of("--filter", "{filter}"), config.getToolchain().getFilterArguments());
            assertEquals(8, config.getDiscovery().getMaxDepth());
            assertEquals(0, config.getRunner().getMaxParallelism());
            assertEquals("coverage.cobertura.xml", config.getRunner().getReportFileName());
            assertEquals(10, config.getDefaults().getTimeoutMinutes());
            assertTrue(config.getDefaults().isRunInParallel());
        }

        @Test
        @DisplayName("should parse toolchain config")
        void shouldParseToolchainConfig() throws Exception {
            String yaml = """
                toolchain:
                  executable: mvn
                  arguments: [test, -f, "{project}", "-Djacoco.destFile={resultsDir}/jacoco.exec"]
                  filter-arguments: ["-Dtest={filter}"]
                """;

            AppConfig config = mapper.readValue(yaml, AppConfig.class);

            assertEquals("mvn", config.getToolchain().getExecutable());
            assertEquals(4, config.getToolchain().getArguments().size());
            assertEquals(List.of("-Dtest={filter}"), config.getToolchain().getFilterArguments());
            // unset keys keep their defaults
            assertEquals(List.of("--version"), config.getToolchain().getVersionArguments());
        }

        @Test
        @DisplayName("should parse discovery and runner config")
        void shouldParseDiscoveryAndRunnerConfig() throws Exception {
            String yaml = """
                discovery:
                  test-framework-markers: [xunit]
                  test-name-pattern: ".*Specs"
                  ignored-directories: [build]
                  max-depth: 3
                runner:
                  max-parallelism: 2
                  results-directory: coverage-out
                """;

            AppConfig config = mapper.readValue(yaml, AppConfig.class);

            assertEquals(List.of("xunit"), config.getDiscovery().getTestFrameworkMarkers());
            assertEquals(".*Specs", config.getDiscovery().getTestNamePattern());
            assertEquals(List.of("build"), config.getDiscovery().getIgnoredDirectories());
            assertEquals(3, config.getDiscovery().getMaxDepth());
            assertEquals(2, config.getRunner().getMaxParallelism());
            assertEquals("coverage-out", config.getRunner().getResultsDirectory());
            assertEquals("coverage.cobertura.xml", config.getRunner().getReportFileName());
        }

        @Test
        @DisplayName("should parse default analysis options")
        void shouldParseDefaultOptions() throws Exception {
            String yaml = """
                defaults:
                  timeoutMinutes: 30
                  runInParallel: false
                  excludedFiles: ["glob:**/Migrations/**"]
                  testFilter: "Category!=Slow"
                """;

            AppConfig config = mapper.readValue(yaml, AppConfig.class);

            assertEquals(30, config.getDefaults().getTimeoutMinutes());
            assertFalse(config.getDefaults().isRunInParallel());
            assertTrue(config.getDefaults().isCollectBranchCoverage());
            assertEquals(List.of("glob:**/Migrations/**"), config.getDefaults().getExcludedFiles());
            assertEquals("Category!=Slow", config.getDefaults().getTestFilter());
        }
    }

    @Nested
    @DisplayName("Bundled defaults")
    class BundledDefaults {

        @Test
        @DisplayName("should match the built-in defaults")
        void bundledFileShouldMatchBuiltInDefaults() throws Exception {
            AppConfig bundled;
            try (InputStream in = getClass().getClassLoader().getResourceAsStream(ConfigLoader.CONFIG_FILE_NAME)) {
                assertNotNull(in, "bundled configuration missing");
                bundled = mapper.readValue(in, AppConfig.class);
            }

            assertEquals(new AppConfig(), bundled);
        }
    }
}
