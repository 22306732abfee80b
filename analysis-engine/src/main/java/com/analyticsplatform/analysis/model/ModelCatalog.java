package com.analyticsplatform.analysis.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable set of known models, keyed by id.
 *
 * <p>{@code historical_accuracy} is the mean of the most recent {@code accuracyWindow}
 * entries of each model's accuracy history; a window of zero or less uses all of them.
 * A model with no history scores 0.0.
 */
public class ModelCatalog {

    private static final Logger log = LoggerFactory.getLogger(ModelCatalog.class);

    private final Map<String, ModelCatalogEntry> entries;
    private final Map<String, Double> featureDefaults;
    private final int accuracyWindow;

    public ModelCatalog(Collection<ModelCatalogEntry> entries, Map<String, Double> featureDefaults, int accuracyWindow) {
        Map<String, ModelCatalogEntry> byId = new TreeMap<>();
        for (ModelCatalogEntry entry : entries) {
            if (entry.id() == null || entry.id().isBlank() || entry.task() == null) {
                throw new IllegalArgumentException("Catalog entry needs an id and a task: " + entry);
            }
            if (byId.putIfAbsent(entry.id(), entry) != null) {
                throw new IllegalArgumentException("Duplicate model id '" + entry.id() + "' in catalog");
            }
        }
        this.entries = Collections.unmodifiableMap(byId);
        this.featureDefaults = featureDefaults == null ? Map.of() : Map.copyOf(featureDefaults);
        this.accuracyWindow = accuracyWindow;
    }

    public static ModelCatalog load(Path manifestPath, ObjectMapper mapper, int accuracyWindow) {
        if (!Files.isRegularFile(manifestPath)) {
            log.warn("[ModelCatalog] Manifest not found path={}; starting with an empty catalog", manifestPath);
            return new ModelCatalog(List.of(), Map.of(), accuracyWindow);
        }
        try {
            ModelManifest manifest = mapper.readValue(manifestPath.toFile(), ModelManifest.class);
            log.info("[ModelCatalog] Loaded manifest path={} models={} accuracyWindow={}",
                     manifestPath, manifest.models().size(), accuracyWindow);
            return new ModelCatalog(manifest.models(), manifest.featureDefaults(), accuracyWindow);
        } catch (IOException e) {
            throw new UncheckedIOException("Unreadable model manifest " + manifestPath, e);
        }
    }

    public Optional<ModelCatalogEntry> entry(String modelId) {
        return modelId == null ? Optional.empty() : Optional.ofNullable(entries.get(modelId));
    }

    public Collection<ModelCatalogEntry> entries() {
        return entries.values();
    }

    public Map<String, Double> featureDefaults() {
        return featureDefaults;
    }

    public int accuracyWindow() {
        return accuracyWindow;
    }

    public ModelDescriptor describe(ModelCatalogEntry entry) {
        return new ModelDescriptor(entry.id(), entry.task(), entry.requiredFeatures(),
            historicalAccuracy(entry), entry.version(), entry.description());
    }

    public double historicalAccuracy(ModelCatalogEntry entry) {
        List<Double> history = entry.accuracyHistory();
        if (history.isEmpty()) return 0.0;
        int from = (accuracyWindow <= 0 || accuracyWindow >= history.size()) ? 0 : history.size() - accuracyWindow;
        return history.subList(from, history.size()).stream()
            .mapToDouble(Double::doubleValue)
            .average()
            .orElse(0.0);
    }

    /** Accuracy per requested id, in request order. Unknown ids are skipped. */
    public Map<String, Double> historicalAccuracies(List<String> modelIds) {
        Map<String, Double> out = new LinkedHashMap<>();
        for (String id : modelIds) {
            entry(id).ifPresent(e -> out.put(id, historicalAccuracy(e)));
        }
        return out;
    }
}
