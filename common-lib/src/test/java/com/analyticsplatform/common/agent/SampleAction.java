package com.analyticsplatform.common.agent;

import com.analyticsplatform.common.permission.PermissionLevel;

import java.util.List;

enum SampleAction implements AgentAction {
    READ_DATA("read_data", PermissionLevel.READ_ONLY),
    RUN_JOB("run_job", PermissionLevel.READ_EXECUTE),
    PURGE("purge", PermissionLevel.ADMIN);

    private final AgentCapability capability;

    SampleAction(String name, PermissionLevel required) {
        this.capability = AgentCapability.of(name, name, required, List.of(), List.of(), 0.1);
    }

    @Override
    public AgentCapability capability() {
        return capability;
    }
}
