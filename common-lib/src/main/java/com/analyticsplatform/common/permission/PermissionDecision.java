package com.analyticsplatform.common.permission;

public enum PermissionDecision {
    GRANTED,
    DENIED,
    CAPABILITY_NOT_FOUND
}
