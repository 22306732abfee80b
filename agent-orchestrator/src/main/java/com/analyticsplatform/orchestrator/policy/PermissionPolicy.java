package com.analyticsplatform.orchestrator.policy;

import com.analyticsplatform.common.model.UserRole;
import com.analyticsplatform.common.permission.PermissionLevel;

import java.util.Map;
import java.util.Set;

/**
 * Decides the permission level granted to a caller for one request.
 *
 * <pre>
 *   base    = ADMIN                 if userId ∈ adminUsers
 *           = ROLE_LEVELS[role]     otherwise
 *   granted = min(base, hint "permission_level")   (a hint never raises the level)
 * </pre>
 */
public class PermissionPolicy {

    private static final Map<UserRole, PermissionLevel> ROLE_LEVELS = Map.of(
        UserRole.ANALYST,        PermissionLevel.READ_EXECUTE_WRITE,
        UserRole.DATA_SCIENTIST, PermissionLevel.READ_EXECUTE_WRITE,
        UserRole.PRODUCTION,     PermissionLevel.READ_EXECUTE
    );

    private final Set<String> adminUsers;

    public PermissionPolicy(Set<String> adminUsers) {
        this.adminUsers = adminUsers == null ? Set.of() : Set.copyOf(adminUsers);
    }

    public PermissionLevel grantedLevel(String userId, UserRole role, Map<String, Object> hints) {
        PermissionLevel base = (userId != null && adminUsers.contains(userId))
            ? PermissionLevel.ADMIN
            : ROLE_LEVELS.getOrDefault(role, PermissionLevel.READ_ONLY);

        Object requested = hints == null ? null : hints.get("permission_level");
        if (requested == null) return base;
        return PermissionLevel.parse(requested.toString()).map(base::min).orElse(base);
    }
}
