package com.analyticsplatform.common.agent;

import com.analyticsplatform.common.exception.AnalyticsErrorCode;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tagged outcome of one agent action: either {@code success + payload} or
 * {@code error + code + message}. Business failures travel in this shape; they are never thrown.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ActionResult(
    @JsonProperty("success") boolean success,
    @JsonProperty("payload") Map<String, Object> payload,
    @JsonProperty("error_code") AnalyticsErrorCode errorCode,
    @JsonProperty("message") String message
) {
    public static ActionResult success(Map<String, Object> payload) {
        Map<String, Object> copy = payload == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        return new ActionResult(true, copy, null, null);
    }

    public static ActionResult error(AnalyticsErrorCode code, String message) {
        return new ActionResult(false, null, code, message);
    }

    @JsonIgnore
    public boolean isError() {
        return !success;
    }
}
