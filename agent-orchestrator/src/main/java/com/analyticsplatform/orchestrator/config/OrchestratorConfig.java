package com.analyticsplatform.orchestrator.config;

import com.analyticsplatform.analysis.agent.InsightGeneratorAgent;
import com.analyticsplatform.analysis.agent.LearningNavigatorAgent;
import com.analyticsplatform.analysis.agent.ModelEngineAgent;
import com.analyticsplatform.analysis.engine.ModelExecutionEngine;
import com.analyticsplatform.analysis.feature.FeatureTable;
import com.analyticsplatform.common.agent.AgentConstructor;
import com.analyticsplatform.common.agent.AgentFactory;
import com.analyticsplatform.common.context.ContextManager;
import com.analyticsplatform.common.metrics.MetricsSink;
import com.analyticsplatform.orchestrator.logger.RequestFlowLogger;
import com.analyticsplatform.orchestrator.metrics.AtomicMetricsSink;
import com.analyticsplatform.orchestrator.policy.PermissionPolicy;
import com.analyticsplatform.orchestrator.routing.RoutingTable;
import com.analyticsplatform.orchestrator.service.AnalyticsOrchestrator;
import com.analyticsplatform.orchestrator.service.SessionHistory;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;

@Configuration
public class OrchestratorConfig {

    @Value("${analytics.context.base-token-budget:100000}")
    private int baseTokenBudget;

    @Value("${analytics.orchestrator.agent-timeout:10s}")
    private Duration agentTimeout;

    @Value("${analytics.orchestrator.max-concurrency:4}")
    private int maxConcurrency;

    @Value("${analytics.orchestrator.admin-users:}")
    private List<String> adminUsers;

    @Value("${analytics.orchestrator.session-history-size:100}")
    private int sessionHistorySize;

    @Value("${analytics.models.default-model:ridge_model_2025}")
    private String defaultModelId;

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public ContextManager contextManager() {
        return new ContextManager(baseTokenBudget);
    }

    /**
     * Registers every agent type and creates one long-lived instance per type, using the type
     * name as instance id so that {@link RoutingTable#defaults()} can address it.
     */
    @Bean
    public AgentFactory agentFactory(ModelExecutionEngine modelExecutionEngine, FeatureTable featureTable) {
        AgentFactory factory = new AgentFactory();

        AgentConstructor modelEngine = id -> new ModelEngineAgent(id, modelExecutionEngine, featureTable, defaultModelId);
        AgentConstructor insightGenerator = id -> new InsightGeneratorAgent(id, featureTable);
        AgentConstructor learningNavigator = LearningNavigatorAgent::new;

        factory.register(ModelEngineAgent.TYPE, modelEngine);
        factory.register(InsightGeneratorAgent.TYPE, insightGenerator);
        factory.register(LearningNavigatorAgent.TYPE, learningNavigator);

        factory.create(ModelEngineAgent.TYPE, RoutingTable.MODEL_ENGINE);
        factory.create(InsightGeneratorAgent.TYPE, RoutingTable.INSIGHT_GENERATOR);
        factory.create(LearningNavigatorAgent.TYPE, RoutingTable.LEARNING_NAVIGATOR);
        return factory;
    }

    @Bean
    public RoutingTable routingTable() {
        return RoutingTable.defaults();
    }

    @Bean
    public PermissionPolicy permissionPolicy() {
        return new PermissionPolicy(new HashSet<>(adminUsers));
    }

    @Bean
    public MetricsSink metricsSink() {
        return new AtomicMetricsSink();
    }

    @Bean
    public AnalyticsOrchestrator analyticsOrchestrator(AgentFactory agentFactory,
                                                       ContextManager contextManager,
                                                       RoutingTable routingTable,
                                                       PermissionPolicy permissionPolicy,
                                                       MetricsSink metricsSink,
                                                       RequestFlowLogger requestFlowLogger) {
        return new AnalyticsOrchestrator(agentFactory, contextManager, routingTable, permissionPolicy,
            metricsSink, requestFlowLogger, new SessionHistory(sessionHistorySize), agentTimeout, maxConcurrency);
    }
}
