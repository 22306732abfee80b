package com.analyticsplatform.orchestrator.logger;

import com.analyticsplatform.common.trace.TraceContextUtil;
import com.analyticsplatform.orchestrator.service.RequestState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Logs each {@link RequestState} transition of a request. Pure side-effects; no business
 * logic and no change to pipeline behaviour.
 *
 * <pre>
 *     requestFlowLogger.transition(RequestState.ROLE_DETECTED, requestId, "role=analyst");
 * </pre>
 */
@Component
public class RequestFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(RequestFlowLogger.class);

    public void transition(RequestState state, String requestId) {
        TraceContextUtil.withMdc(requestId, () ->
            log.info("[RequestFlow] state={} requestId={}", state, requestId)
        );
    }

    public void transition(RequestState state, String requestId, String detail) {
        TraceContextUtil.withMdc(requestId, () ->
            log.info("[RequestFlow] state={} requestId={} {}", state, requestId, detail)
        );
    }

    public void failed(String requestId, Throwable cause) {
        TraceContextUtil.withMdc(requestId, () ->
            log.error("[RequestFlow] state={} requestId={}", RequestState.FAILED, requestId, cause)
        );
    }
}
