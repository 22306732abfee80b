package com.analyticsplatform.orchestrator.service;

/**
 * Request lifecycle:
 * <pre>
 *   RECEIVED → ROLE_DETECTED → AGENTS_SELECTED → EXECUTING → SYNTHESIZING → COMPLETED
 *                                                                         ↘ FAILED
 * </pre>
 * Any state may move to {@link #FAILED} on an unexpected error.
 */
public enum RequestState {
    RECEIVED,
    ROLE_DETECTED,
    AGENTS_SELECTED,
    EXECUTING,
    SYNTHESIZING,
    COMPLETED,
    FAILED
}
