package com.analyticsplatform.analysis.feature;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a feature table file of the form
 * <pre>
 *   {"rows": [{"game_id": "2025_12_ohio-state_michigan", "features": {"home_elo": 1820.0, ...}}]}
 * </pre>
 * A missing file yields an empty table.
 */
public final class FeatureTableLoader {

    private static final Logger log = LoggerFactory.getLogger(FeatureTableLoader.class);

    record Row(@JsonProperty("game_id") String gameId,
               @JsonProperty("features") Map<String, Double> features) {}

    record TableFile(@JsonProperty("rows") List<Row> rows) {}

    private FeatureTableLoader() {}

    public static FeatureTable load(Path path, ObjectMapper mapper) {
        if (!Files.isRegularFile(path)) {
            log.warn("[FeatureTable] File not found path={}; serving an empty table", path);
            return InMemoryFeatureTable.empty();
        }
        try {
            TableFile file = mapper.readValue(path.toFile(), TableFile.class);
            Map<String, Map<String, Double>> rows = new LinkedHashMap<>();
            if (file.rows() != null) {
                for (Row row : file.rows()) {
                    if (row.gameId() != null && row.features() != null) {
                        rows.put(row.gameId(), row.features());
                    }
                }
            }
            log.info("[FeatureTable] Loaded path={} rows={}", path, rows.size());
            return new InMemoryFeatureTable(rows);
        } catch (IOException e) {
            throw new UncheckedIOException("Unreadable feature table " + path, e);
        }
    }
}
