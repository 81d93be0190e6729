package com.codelogickeep.coverage.exception;

/**
 * Unified exception for coverage-gate failures that must reach the caller.
 * Carries a structured error code so the CLI can print a recovery hint.
 */
public class CoverageGateException extends RuntimeException {

    private final ErrorCode errorCode;
    private final String context;
    private final String suggestion;

    public CoverageGateException(ErrorCode errorCode, String message, String context) {
        this(errorCode, message, context, null);
    }

    public CoverageGateException(ErrorCode errorCode, String message, String context, Throwable cause) {
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
     * Formats the error for console output: code, message, context and suggestion.
     */
    public String toConsoleMessage() {
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
        return toConsoleMessage();
    }

    /**
     * Error codes grouped by concern.
     */
    public enum ErrorCode {
        // File System Errors (1xx)
        FILE_READ_FAILED("E102", "Failed to read file", "Check file permissions and encoding."),

        // Source Analysis Errors (3xx)
        PARSE_ERROR("E301", "Failed to parse Java source file", "Ensure the file contains valid Java syntax."),

        // Coverage Errors (4xx)
        COVERAGE_REPORT_NOT_FOUND("E401", "JaCoCo coverage report not found", "Run 'mvn test jacoco:report' to generate the report."),
        COVERAGE_PARSE_ERROR("E402", "Failed to parse coverage report", "Ensure the JaCoCo XML report is valid."),

        // Configuration Errors (6xx)
        CONFIG_NOT_FOUND("E601", "Configuration file not found", "Create coverage-gate.yml or use --config to specify one."),
        CONFIG_INVALID("E602", "Invalid configuration", "Check the configuration file for invalid values.");

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
