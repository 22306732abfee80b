package com.analyticsplatform.common.agent;

import com.analyticsplatform.common.context.BuiltContext;
import com.analyticsplatform.common.model.UserRole;
import com.analyticsplatform.common.permission.PermissionLevel;

/**
 * What an agent may know about its caller for one request. Immutable; agents must not
 * retain it beyond the {@code execute} call.
 */
public record CallerContext(
    String requestId,
    String userId,
    UserRole role,
    PermissionLevel grantedLevel,
    BuiltContext supportingContext
) {
    public static CallerContext of(String requestId, String userId, PermissionLevel grantedLevel,
                                   BuiltContext supportingContext) {
        return new CallerContext(requestId, userId, supportingContext.role(), grantedLevel, supportingContext);
    }

    public double budgetFraction() {
        if (supportingContext != null) return supportingContext.budgetFraction();
        return role != null ? role.budgetFraction() : UserRole.ANALYST.budgetFraction();
    }
}
