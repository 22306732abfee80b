package com.analyticsplatform.common.exception;

public enum ErrorCategory {
    PERMISSION,
    ROUTING,
    DATA,
    MODEL,
    TIMEOUT,
    AGENT
}
