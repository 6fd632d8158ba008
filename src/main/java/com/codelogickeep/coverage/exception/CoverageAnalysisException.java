package com.codelogickeep.coverage.exception;

/**
 * Unified exception for coverage analysis failures.
 * Carries an error code, optional context and a suggestion so that the failure can be
 * reported to a caller as a plain message without losing its category.
 */
public class CoverageAnalysisException extends RuntimeException {

    private final ErrorCode errorCode;
    private final String context;
    private final String suggestion;

    public CoverageAnalysisException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
        this.context = null;
        this.suggestion = errorCode.getSuggestion();
    }

    public CoverageAnalysisException(ErrorCode errorCode, String message, String context) {
        super(message);
        this.errorCode = errorCode;
        this.context = context;
        this.suggestion = errorCode.getSuggestion();
    }

    public CoverageAnalysisException(ErrorCode errorCode, String message, String context, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.context = context;
        this.suggestion = errorCode.getSuggestion();
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public String getContext() {
        return context;
    }

    public String getSuggestion() {
        return suggestion;
    }

    /**
     * Formats the error with its code, context and suggestion, e.g. for CLI output.
     */
    public String toDisplayMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("ERROR [").append(errorCode.getCode()).append("]: ").append(getMessage());

        if (context != null && !context.isEmpty()) {
            sb.append("\nContext: ").append(context);
        }

        if (suggestion != null && !suggestion.isEmpty()) {
            sb.append("\nSuggestion: ").append(suggestion);
        }

        return sb.toString();
    }

    @Override
    public String toString() {
        return toDisplayMessage();
    }

    /**
     * Error codes grouped by the stage of the analysis that failed.
     */
    public enum ErrorCode {
        // Workspace Errors (1xx)
        NO_WORKSPACE("E101", "No workspace loaded", "Load a workspace (--workspace) before running coverage analysis."),
        WORKSPACE_LOAD_FAILED("E102", "Failed to load workspace", "Check that the workspace directory exists and is readable."),

        // Discovery Errors (2xx)
        DISCOVERY_FAILED("E201", "Project metadata could not be read", "Check that the project descriptor is well-formed XML."),
        NO_TEST_PROJECTS("E202", "No test projects found", "Check the project filters and the configured test-framework markers."),

        // Process Errors (3xx)
        PROCESS_LAUNCH_FAILED("E301", "Test process failed to start or exited unexpectedly", "Ensure the test toolchain is installed and on the PATH (run 'check-env')."),
        PROCESS_TIMEOUT("E302", "Test process timed out", "Increase the timeout or narrow the test filter."),
        PROCESS_CANCELLED("E303", "Test process was cancelled", "Run the analysis again."),

        // Report Errors (4xx)
        REPORT_NOT_FOUND("E401", "Coverage report not found", "Make sure the test run collects coverage in Cobertura format."),
        REPORT_PARSE_FAILED("E402", "Failed to parse coverage report", "Ensure the coverage report is valid Cobertura XML."),
        NO_COVERAGE_DATA("E403", "No coverage data was generated", "Check the per-project test runs for failures."),

        // Comparison Errors (5xx)
        COMPARISON_FAILED("E501", "Coverage comparison failed", "Provide a baseline produced by a successful analysis."),

        // Configuration Errors (6xx)
        CONFIG_NOT_FOUND("E601", "Configuration file not found", "Create a coverage-analyzer.yml or use --config to specify one."),
        CONFIG_INVALID("E602", "Invalid configuration", "Check the configuration file for invalid values."),

        // Serialization Errors (7xx)
        SERIALIZATION_FAILED("E701", "Failed to read or write JSON", "Check that the file contains a result produced by this tool."),

        // General Errors (9xx)
        UNKNOWN_ERROR("E999", "Unknown error occurred", "Check the logs for more details.");

        private final String code;
        private final String description;
        private final String suggestion;

        ErrorCode(String code, String description, String suggestion) {
            this.code = code;
            this.description = description;
            this.suggestion = suggestion;
        }

        public String getCode() {
            return code;
        }

        public String getDescription() {
            return description;
        }

        public String getSuggestion() {
            return suggestion;
        }
    }
}
