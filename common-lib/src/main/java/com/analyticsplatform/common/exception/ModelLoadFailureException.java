package com.analyticsplatform.common.exception;

import java.util.Map;

/**
 * The artifact for a model exists but could not be deserialized. The model stays
 * unavailable for the remainder of the process lifetime.
 */
public class ModelLoadFailureException extends AnalyticsException {

    private final String modelId;

    public ModelLoadFailureException(String modelId, String reason, Throwable cause) {
        super(AnalyticsErrorCode.MODEL_LOAD_FAILURE,
            "Model '" + modelId + "' failed to load: " + reason,
            Map.of("modelId", modelId), cause);
        this.modelId = modelId;
    }

    public String getModelId() {
        return modelId;
    }
}
