package com.di.tripstar.util;

import lombok.extern.slf4j.Slf4j;

import java.util.regex.Pattern;

/**
 * Input validation for identifiers that end up inside SQL text.
 * BigQuery does not accept parameters for project, dataset or table names, so
 * those are checked here before being interpolated.
 */
@Slf4j
public final class InputValidator {

    private InputValidator() {}

    // ============================================================================
    // Identifier Patterns
    // ============================================================================

    /**
     * BigQuery project id: 6-30 chars, lowercase letters, digits and hyphens,
     * starts with a letter, does not end with a hyphen. Domain-scoped ids
     * ({@code example.com:my-project}) are accepted.
     */
    private static final Pattern PROJECT_ID_PATTERN = Pattern.compile(
            "^([a-z0-9.-]+:)?[a-z][a-z0-9-]{4,28}[a-z0-9]$"
    );

    /** Dataset and table names: letters, digits and underscores. */
    private static final Pattern NAME_PATTERN = Pattern.compile(
            "^[A-Za-z_][A-Za-z0-9_]*$"
    );

    /**
     * Statement terminators, comments, quotes and backticks: never legal in the
     * identifiers above, rejected early with a clearer message.
     */
    private static final Pattern SQL_INJECTION_PATTERN = Pattern.compile(
            "(--|/\\*|\\*/|;|'|\"|`|\\s)"
    );

    private static final int MAX_NAME_LENGTH = 1024;

    // ============================================================================
    // Validation
    // ============================================================================

    /**
     * @return the trimmed project id
     * @throws IllegalArgumentException if the id is null, blank or malformed
     */
    public static String validateProjectId(String projectId) {
        String trimmed = requireText(projectId, "Project id");
        rejectDangerous(trimmed, "Project id");
        if (!PROJECT_ID_PATTERN.matcher(trimmed).matches()) {
            throw new IllegalArgumentException(String.format(
                    "Invalid project id format: '%s'. Expected 6-30 lowercase letters, digits or hyphens, starting with a letter.",
                    trimmed));
        }
        return trimmed;
    }

    public static String validateDatasetName(String dataset) {
        return validateName(dataset, "Dataset name");
    }

    public static String validateTableName(String table) {
        return validateName(table, "Table name");
    }

    public static String validateColumnName(String column) {
        return validateName(column, "Column name");
    }

    private static String validateName(String name, String identifierType) {
        String trimmed = requireText(name, identifierType);
        if (trimmed.length() > MAX_NAME_LENGTH) {
            throw new IllegalArgumentException(String.format(
                    "%s exceeds maximum length of %d characters", identifierType, MAX_NAME_LENGTH));
        }
        rejectDangerous(trimmed, identifierType);
        if (!NAME_PATTERN.matcher(trimmed).matches()) {
            throw new IllegalArgumentException(String.format(
                    "Invalid %s format: '%s'. Must start with a letter or underscore, followed by letters, digits or underscores.",
                    identifierType.toLowerCase(), trimmed));
        }
        return trimmed;
    }

    private static String requireText(String value, String identifierType) {
        if (value == null) {
            throw new IllegalArgumentException(identifierType + " cannot be null");
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException(identifierType + " cannot be empty");
        }
        return trimmed;
    }

    private static void rejectDangerous(String value, String identifierType) {
        if (SQL_INJECTION_PATTERN.matcher(value).find()) {
            log.warn("Potential SQL injection attempt detected in {}: {}", identifierType, sanitizeForLogging(value));
            throw new IllegalArgumentException(String.format(
                    "Invalid %s: contains potentially dangerous SQL patterns", identifierType.toLowerCase()));
        }
    }

    /**
     * Strips control characters and truncates, so user input can be logged safely.
     */
    public static String sanitizeForLogging(String input) {
        if (input == null) {
            return "null";
        }
        String cleaned = input.replaceAll("[\\r\\n\\t]", " ");
        return cleaned.length() > 200 ? cleaned.substring(0, 200) + "..." : cleaned;
    }
}
