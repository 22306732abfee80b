package com.analyticsplatform.common.exception;

import java.util.List;
import java.util.Map;

/** Required feature keys were absent from the supplied feature map. */
public class FeatureMismatchException extends AnalyticsException {

    private final String modelId;
    private final List<String> missingFeatures;

    public FeatureMismatchException(String modelId, List<String> missingFeatures) {
        super(AnalyticsErrorCode.FEATURE_MISMATCH,
            "Model '" + modelId + "' is missing required features " + missingFeatures,
            Map.of("modelId", modelId, "missingFeatures", List.copyOf(missingFeatures)));
        this.modelId = modelId;
        this.missingFeatures = List.copyOf(missingFeatures);
    }

    public String getModelId() {
        return modelId;
    }

    public List<String> getMissingFeatures() {
        return missingFeatures;
    }
}
