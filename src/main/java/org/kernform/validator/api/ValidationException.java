package org.kernform.validator.api;

/**
 * Thrown when a compilation unit cannot be validated at all (unreadable input, failed workers),
 * or when a caller asks for a unit to be rejected on its first error report.
 * <p>
 * Ordinary defects in contracts or call sites are reported as diagnostics, not thrown.
 */
public class ValidationException extends Exception {

    private final transient ValidationReport report;

    /**
     * Constructs a new validation exception with the specified detail message.
     * @param message The detail message.
     */
    public ValidationException(String message) {
        super(message, null);
        this.report = null;
    }

    /**
     * Constructs a new validation exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public ValidationException(String message, Throwable cause) {
        super(message, cause);
        this.report = null;
    }

    /**
     * Constructs a new validation exception for a report that contains errors.
     * @param message The detail message.
     * @param report The report.
     */
    public ValidationException(String message, ValidationReport report) {
        super(message, null);
        this.report = report;
    }

    /**
     * Returns the report that caused this exception, if any.
     * @return The report, or {@code null}.
     */
    public ValidationReport getReport() {
        return report;
    }
}
