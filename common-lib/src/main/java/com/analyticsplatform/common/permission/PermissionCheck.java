package com.analyticsplatform.common.permission;

import com.analyticsplatform.common.agent.AgentCapability;
import com.analyticsplatform.common.exception.AnalyticsErrorCode;

/**
 * Outcome of {@link PermissionGuard#check}. {@code capability} is null unless exactly one
 * capability matched the requested name.
 */
public record PermissionCheck(
    PermissionDecision decision,
    AgentCapability capability,
    String message
) {
    public static PermissionCheck granted(AgentCapability capability) {
        return new PermissionCheck(PermissionDecision.GRANTED, capability, "granted");
    }

    public static PermissionCheck denied(AgentCapability capability, PermissionLevel callerLevel) {
        return new PermissionCheck(PermissionDecision.DENIED, capability,
            "Capability '" + capability.name() + "' requires " + capability.requiredPermission()
                + " but caller holds " + callerLevel);
    }

    public static PermissionCheck notFound(String capabilityName, String reason) {
        return new PermissionCheck(PermissionDecision.CAPABILITY_NOT_FOUND, null,
            "Capability '" + capabilityName + "' " + reason);
    }

    public boolean isGranted() {
        return decision == PermissionDecision.GRANTED;
    }

    /** Error code reported for a refused check; null when granted. */
    public AnalyticsErrorCode errorCode() {
        return switch (decision) {
            case GRANTED -> null;
            case DENIED -> AnalyticsErrorCode.PERMISSION_DENIED;
            case CAPABILITY_NOT_FOUND -> AnalyticsErrorCode.CAPABILITY_NOT_FOUND;
        };
    }
}
