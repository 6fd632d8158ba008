package com.codelogickeep.coverage.config;

import com.codelogickeep.coverage.exception.CoverageAnalysisException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Paths;

/**
 * Loads {@link AppConfig} by merging YAML files in increasing priority:
 * classpath defaults, the user home directory, the working directory, then an explicit path.
 */
public class ConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String CONFIG_FILE_NAME = "coverage-analyzer.yml";

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    public AppConfig load(String explicitPath) {
        AppConfig config = new AppConfig();

        // 1. Classpath - base defaults
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(CONFIG_FILE_NAME)) {
            if (in != null) {
                mapper.readerForUpdating(config).readValue(in);
            }
        } catch (IOException e) {
            log.warn("Failed to read bundled {}: {}", CONFIG_FILE_NAME, e.getMessage());
        }

        // 2. User home
        String userHome = System.getProperty("user.home");
        if (userHome != null) {
            mergeConfigFromFile(config, Paths.get(userHome, ".coverage-analyzer", "config.yml").toFile());
        }

        // 3. Current directory
        mergeConfigFromFile(config, new File(CONFIG_FILE_NAME));

        // 4. Explicit path - highest priority, must exist
        if (explicitPath != null) {
            File file = new File(explicitPath);
            if (!file.exists()) {
                throw new CoverageAnalysisException(
                        CoverageAnalysisException.ErrorCode.CONFIG_NOT_FOUND,
                        "Configuration file not found: " + file.getAbsolutePath());
            }
            mergeConfigFromFile(config, file);
        }

        ConfigValidator.applyDefaults(config);
        config.getToolchain().setExecutable(replaceEnvVars(config.getToolchain().getExecutable()));
        ConfigValidator.validate(config);
        return config;
    }

    void mergeConfigFromFile(AppConfig config, File file) {
        if (file.exists()) {
            try {
                mapper.readerForUpdating(config).readValue(file);
                log.info("Merged configuration from {}", file.getAbsolutePath());
            } catch (IOException e) {
                log.warn("Failed to merge config from {}: {}", file.getAbsolutePath(), e.getMessage());
            }
        }
    }

    /**
     * Resolves a value of the form {@code ${env:NAME}} from the environment.
     */
    static String replaceEnvVars(String value) {
        if (value == null || !value.startsWith("${env:") || !value.endsWith("}")) {
            return value;
        }
        String envVar = value.substring(6, value.length() - 1);
        String envValue = System.getenv(envVar);
        return envValue != null ? envValue : value;
    }
}
