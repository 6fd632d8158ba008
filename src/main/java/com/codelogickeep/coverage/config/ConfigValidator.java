package com.codelogickeep.coverage.config;

import com.codelogickeep.coverage.exception.CoverageAnalysisException;
import com.codelogickeep.coverage.model.CoverageAnalysisOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Validates AppConfig and fills in missing sections.
 */
public class ConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(ConfigValidator.class);

    private static final int MAX_TIMEOUT_MINUTES = 24 * 60;

    /**
     * Validates the configuration.
     *
     * @throws CoverageAnalysisException if a value is invalid
     */
    public static void validate(AppConfig config) {
        if (config == null) {
            throw new CoverageAnalysisException(
                    CoverageAnalysisException.ErrorCode.CONFIG_INVALID,
                    "Configuration is null",
                    "No configuration loaded"
            );
        }

        List<String> errors = new ArrayList<>();

        AppConfig.ToolchainConfig toolchain = config.getToolchain();
        if (toolchain == null || isNullOrEmpty(toolchain.getExecutable())) {
            errors.add("toolchain.executable: test runner executable is required");
        } else if (toolchain.getArguments() == null || toolchain.getArguments().isEmpty()) {
            errors.add("toolchain.arguments: at least one argument is required");
        }

        AppConfig.DiscoveryConfig discovery = config.getDiscovery();
        if (discovery != null) {
            if (discovery.getDescriptorPatterns() == null || discovery.getDescriptorPatterns().isEmpty()) {
                errors.add("discovery.descriptor-patterns: at least one pattern is required");
            }
            if (discovery.getTestNamePattern() != null) {
                try {
                    Pattern.compile(discovery.getTestNamePattern());
                } catch (PatternSyntaxException e) {
                    errors.add("discovery.test-name-pattern: invalid regex '" + discovery.getTestNamePattern() + "'");
                }
            }
            if (discovery.getMaxDepth() <= 0) {
                errors.add("discovery.max-depth: must be positive");
            }
        }

        AppConfig.RunnerConfig runner = config.getRunner();
        if (runner != null) {
            if (runner.getMaxParallelism() < 0) {
                errors.add("runner.max-parallelism: must be 0 (unbounded) or positive");
            }
            if (isNullOrEmpty(runner.getResultsDirectory())) {
                errors.add("runner.results-directory: directory name is required");
            }
            if (isNullOrEmpty(runner.getReportFileName())) {
                errors.add("runner.report-file-name: file name is required");
            }
        }

        CoverageAnalysisOptions defaults = config.getDefaults();
        if (defaults != null && (defaults.getTimeoutMinutes() <= 0 || defaults.getTimeoutMinutes() > MAX_TIMEOUT_MINUTES)) {
            errors.add("defaults.timeoutMinutes: must be between 1 and " + MAX_TIMEOUT_MINUTES);
        }

        if (!errors.isEmpty()) {
            String errorMessage = "Configuration validation failed:\n  - " + String.join("\n  - ", errors);
            throw new CoverageAnalysisException(
                    CoverageAnalysisException.ErrorCode.CONFIG_INVALID,
                    errorMessage,
                    "Check your coverage-analyzer.yml or command line parameters"
            );
        }

        log.info("Configuration validation passed");
    }

    /**
     * Replaces missing sections with their defaults.
     */
    public static void applyDefaults(AppConfig config) {
        if (config == null) {
            return;
        }
        if (config.getToolchain() == null) {
            config.setToolchain(new AppConfig.ToolchainConfig());
            log.debug("Applied default toolchain configuration");
        }
        if (config.getDiscovery() == null) {
            config.setDiscovery(new AppConfig.DiscoveryConfig());
            log.debug("Applied default discovery configuration");
        }
        if (config.getRunner() == null) {
            config.setRunner(new AppConfig.RunnerConfig());
            log.debug("Applied default runner configuration");
        }
        if (config.getDefaults() == null) {
            config.setDefaults(CoverageAnalysisOptions.defaults());
            log.debug("Applied default analysis options");
        }
    }

    /**
     * Validates after applying defaults, returning the same instance.
     */
    public static AppConfig validateAndApplyDefaults(AppConfig config) {
        applyDefaults(config);
        validate(config);
        return config;
    }

    private static boolean isNullOrEmpty(String value) {
        return value == null || value.trim().isEmpty();
    }
}
