package com.analyticsplatform.common.exception;

/**
 * Stable error codes surfaced in {@code ActionResult} slots and logs.
 *
 * <p>{@link #recoverable()} tells the calling agent whether a retry with corrected input
 * (another model, imputed features, a narrower request) can succeed within the same process.
 */
public enum AnalyticsErrorCode {
    PERMISSION_DENIED    (ErrorCategory.PERMISSION, ErrorSeverity.MEDIUM,   false),
    CAPABILITY_NOT_FOUND (ErrorCategory.ROUTING,    ErrorSeverity.MEDIUM,   false),
    AGENT_NOT_FOUND      (ErrorCategory.ROUTING,    ErrorSeverity.HIGH,     false),
    INVALID_PARAMETERS   (ErrorCategory.DATA,       ErrorSeverity.LOW,      true),
    FEATURES_NOT_FOUND   (ErrorCategory.DATA,       ErrorSeverity.LOW,      true),
    FEATURE_MISMATCH     (ErrorCategory.DATA,       ErrorSeverity.LOW,      true),
    MODEL_NOT_FOUND      (ErrorCategory.MODEL,      ErrorSeverity.MEDIUM,   true),
    MODEL_LOAD_FAILURE   (ErrorCategory.MODEL,      ErrorSeverity.HIGH,     false),
    NUMERIC_OVERFLOW     (ErrorCategory.MODEL,      ErrorSeverity.LOW,      true),
    TIMEOUT              (ErrorCategory.TIMEOUT,    ErrorSeverity.MEDIUM,   false),
    AGENT_EXECUTION_ERROR(ErrorCategory.AGENT,      ErrorSeverity.HIGH,     false);

    private final ErrorCategory category;
    private final ErrorSeverity severity;
    private final boolean recoverable;

    AnalyticsErrorCode(ErrorCategory category, ErrorSeverity severity, boolean recoverable) {
        this.category = category;
        this.severity = severity;
        this.recoverable = recoverable;
    }

    public ErrorCategory category() {
        return category;
    }

    public ErrorSeverity severity() {
        return severity;
    }

    public boolean recoverable() {
        return recoverable;
    }
}
