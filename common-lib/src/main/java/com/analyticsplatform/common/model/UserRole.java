package com.analyticsplatform.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Derived caller classification. The budget fraction scopes how much supporting
 * context is assembled for the caller.
 */
public enum UserRole {
    ANALYST("analyst", 0.50),
    DATA_SCIENTIST("data_scientist", 0.75),
    PRODUCTION("production", 0.25);

    private final String tag;
    private final double budgetFraction;

    UserRole(String tag, double budgetFraction) {
        this.tag = tag;
        this.budgetFraction = budgetFraction;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    public double budgetFraction() {
        return budgetFraction;
    }
}
