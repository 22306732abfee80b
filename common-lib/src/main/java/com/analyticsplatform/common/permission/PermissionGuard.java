package com.analyticsplatform.common.permission;

import com.analyticsplatform.common.agent.AgentCapability;

import java.util.List;

/**
 * Fail-closed permission check of a caller level against an agent's declared capabilities.
 *
 * <p>Rules (evaluated in order):
 * <ol>
 *   <li>null or blank capability name      → CAPABILITY_NOT_FOUND</li>
 *   <li>no capability with that name       → CAPABILITY_NOT_FOUND</li>
 *   <li>more than one capability matches   → CAPABILITY_NOT_FOUND (ambiguous)</li>
 *   <li>null caller level                  → DENIED</li>
 *   <li>caller rank &lt; required rank      → DENIED</li>
 *   <li>otherwise                          → GRANTED</li>
 * </ol>
 *
 * <p>Never escalates. Stateless.
 */
public final class PermissionGuard {

    private PermissionGuard() {}

    public static PermissionCheck check(List<AgentCapability> capabilities,
                                        String capabilityName,
                                        PermissionLevel callerLevel) {
        if (capabilityName == null || capabilityName.isBlank()) {
            return PermissionCheck.notFound(String.valueOf(capabilityName), "is blank");
        }
        if (capabilities == null || capabilities.isEmpty()) {
            return PermissionCheck.notFound(capabilityName, "is not declared");
        }

        AgentCapability match = null;
        for (AgentCapability capability : capabilities) {
            if (capability.name().equals(capabilityName)) {
                if (match != null) {
                    return PermissionCheck.notFound(capabilityName, "is ambiguous");
                }
                match = capability;
            }
        }
        if (match == null) {
            return PermissionCheck.notFound(capabilityName, "is not declared");
        }

        if (callerLevel == null) {
            return new PermissionCheck(PermissionDecision.DENIED, match, "Caller holds no permission level");
        }
        if (!callerLevel.permits(match.requiredPermission())) {
            return PermissionCheck.denied(match, callerLevel);
        }
        return PermissionCheck.granted(match);
    }
}
