package com.analyticsplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RoleProfile(
    @JsonProperty("role") UserRole role,
    @JsonProperty("budget_fraction") double budgetFraction
) {}
