package com.analyticsplatform.common.context;

/** Truncation priority of a context item. Lower {@code priority} survives longer. */
public enum ContextTier {
    REQUESTED_ENTITY(1),
    ROLE_EXPLANATION(2),
    HISTORICAL_BACKGROUND(3);

    private final int priority;

    ContextTier(int priority) {
        this.priority = priority;
    }

    public int priority() {
        return priority;
    }
}
