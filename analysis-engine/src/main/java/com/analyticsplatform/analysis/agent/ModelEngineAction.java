package com.analyticsplatform.analysis.agent;

import com.analyticsplatform.common.agent.AgentAction;
import com.analyticsplatform.common.agent.AgentCapability;

import java.util.List;

import static com.analyticsplatform.common.permission.PermissionLevel.ADMIN;
import static com.analyticsplatform.common.permission.PermissionLevel.READ_EXECUTE;
import static com.analyticsplatform.common.permission.PermissionLevel.READ_EXECUTE_WRITE;
import static com.analyticsplatform.common.permission.PermissionLevel.READ_ONLY;

public enum ModelEngineAction implements AgentAction {
    PREDICT_GAME_OUTCOME(AgentCapability.of("predict_game_outcome",
        "Predict one game with a single model",
        READ_EXECUTE, List.of("model_registry", "feature_table"), List.of("models", "features"), 2.0)),
    ENSEMBLE_PREDICTION(AgentCapability.of("ensemble_prediction",
        "Weighted ensemble prediction for one game",
        READ_EXECUTE, List.of("model_registry", "feature_table"), List.of("models", "features"), 4.0)),
    MODEL_COMPARISON(AgentCapability.of("model_comparison",
        "Run several models side by side on one game",
        READ_EXECUTE_WRITE, List.of("model_registry", "feature_table"), List.of("models", "features"), 5.0)),
    BATCH_PREDICTIONS(AgentCapability.of("batch_predictions",
        "Predict a list of games with one model",
        READ_EXECUTE_WRITE, List.of("model_registry", "feature_table"), List.of("models", "features"), 10.0)),
    LIST_MODELS(AgentCapability.of("list_models",
        "List available models with task, features and accuracy",
        READ_ONLY, List.of("model_registry"), List.of("models"), 0.5)),
    MODEL_HEALTH_CHECK(AgentCapability.of("model_health_check",
        "Load every catalog model and report its status",
        ADMIN, List.of("model_registry"), List.of("models"), 15.0));

    private final AgentCapability capability;

    ModelEngineAction(AgentCapability capability) {
        this.capability = capability;
    }

    @Override
    public AgentCapability capability() {
        return capability;
    }
}
