package com.analyticsplatform.analysis.engine;

import com.analyticsplatform.analysis.model.ModelTask;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Weighted-mean {@link EnsembleStrategy}.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Group predictions by task. Within a group, rescale weights so they sum to 1:
 *       {@code w'_i = w_i / W_task}.</li>
 *   <li>{@code mean_task = Σ w'_i × x_i}. Win probability is then clamped to
 *       [{@value #MIN_PROBABILITY}, {@value #MAX_PROBABILITY}].</li>
 *   <li>{@code variance_task = Σ w'_i × (x_i − mean_task)²};
 *       {@code disagreement_task = min(1, variance_task / task.maxVariance())}.</li>
 *   <li>{@code confidence = 1 − Σ W_task × disagreement_task}.</li>
 *   <li>If any member was clamped after a numeric overflow, confidence is capped at
 *       {@link ModelExecutionEngine#OVERFLOW_CONFIDENCE}. Members clamped to the same bound
 *       agree exactly, so variance alone would report full confidence.</li>
 * </ol>
 *
 * <p>This class is stateless and thread-safe.
 */
public class WeightedMeanEnsembleStrategy implements EnsembleStrategy {

    static final double MIN_PROBABILITY = 0.01;
    static final double MAX_PROBABILITY = 0.99;

    @Override
    public EnsembleResult combine(List<PredictionResult> predictions, Map<String, Double> weights) {
        Map<ModelTask, List<PredictionResult>> byTask = new EnumMap<>(ModelTask.class);
        for (PredictionResult p : predictions) {
            byTask.computeIfAbsent(p.task(), t -> new ArrayList<>()).add(p);
        }

        Double margin = null;
        Double winProbability = null;
        Map<ModelTask, Double> disagreement = new EnumMap<>(ModelTask.class);
        double weightedDisagreement = 0.0;

        for (Map.Entry<ModelTask, List<PredictionResult>> group : byTask.entrySet()) {
            ModelTask task = group.getKey();
            List<PredictionResult> members = group.getValue();

            double taskWeight = members.stream()
                .mapToDouble(p -> weights.getOrDefault(p.modelId(), 0.0))
                .sum();

            // ── weighted mean ───────────────────────────────────────────────
            double mean = 0.0;
            for (PredictionResult p : members) {
                mean += share(p, weights, taskWeight, members.size()) * p.value();
            }

            // ── weighted variance, scaled by task range ─────────────────────
            double variance = 0.0;
            for (PredictionResult p : members) {
                double d = p.value() - mean;
                variance += share(p, weights, taskWeight, members.size()) * d * d;
            }
            double normalized = Math.min(1.0, variance / task.maxVariance());
            disagreement.put(task, normalized);
            weightedDisagreement += taskWeight * normalized;

            if (task == ModelTask.MARGIN) {
                margin = mean;
            } else {
                winProbability = Math.max(MIN_PROBABILITY, Math.min(MAX_PROBABILITY, mean));
            }
        }

        double confidence = Math.max(0.0, Math.min(1.0, 1.0 - weightedDisagreement));
        if (predictions.stream().anyMatch(PredictionResult::clamped)) {
            confidence = Math.min(confidence, ModelExecutionEngine.OVERFLOW_CONFIDENCE);
        }
        List<String> ids = predictions.stream().map(PredictionResult::modelId).toList();
        Map<String, Double> used = new LinkedHashMap<>();
        for (String id : ids) {
            used.put(id, weights.getOrDefault(id, 0.0));
        }
        return new EnsembleResult(ids, used, margin, winProbability, confidence,
            disagreement, predictions, Map.of());
    }

    private static double share(PredictionResult p, Map<String, Double> weights, double taskWeight, int size) {
        return taskWeight > 0.0 ? weights.getOrDefault(p.modelId(), 0.0) / taskWeight : 1.0 / size;
    }
}
