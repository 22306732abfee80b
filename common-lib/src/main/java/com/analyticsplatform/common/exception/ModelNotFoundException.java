package com.analyticsplatform.common.exception;

import java.util.Map;

public class ModelNotFoundException extends AnalyticsException {

    private final String modelId;

    public ModelNotFoundException(String modelId, String reason) {
        super(AnalyticsErrorCode.MODEL_NOT_FOUND,
            "Model '" + modelId + "' not found: " + reason,
            Map.of("modelId", modelId));
        this.modelId = modelId;
    }

    public String getModelId() {
        return modelId;
    }
}
