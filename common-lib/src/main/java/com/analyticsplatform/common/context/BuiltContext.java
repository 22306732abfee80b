package com.analyticsplatform.common.context;

import com.analyticsplatform.common.model.RoleProfile;
import com.analyticsplatform.common.model.UserRole;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Result of {@link ContextManager#buildContext}: the detected role, its budget and the
 * supporting context that fit inside it, in priority order.
 */
public record BuiltContext(
    @JsonProperty("role") UserRole role,
    @JsonProperty("budget_fraction") double budgetFraction,
    @JsonProperty("token_budget") int tokenBudget,
    @JsonProperty("tokens_used") int tokensUsed,
    @JsonProperty("items") List<ContextItem> items,
    @JsonProperty("dropped") List<ContextItem> dropped
) {
    public BuiltContext {
        items   = items == null ? List.of() : List.copyOf(items);
        dropped = dropped == null ? List.of() : List.copyOf(dropped);
    }

    public RoleProfile profile() {
        return new RoleProfile(role, budgetFraction);
    }

    public boolean truncated() {
        return !dropped.isEmpty();
    }

    public List<ContextItem> itemsOf(ContextTier tier) {
        return items.stream().filter(i -> i.tier() == tier).toList();
    }
}
