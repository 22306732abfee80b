package com.analyticsplatform.analysis.artifact;

import com.analyticsplatform.analysis.model.ModelCatalogEntry;
import com.analyticsplatform.common.exception.ModelLoadFailureException;
import com.analyticsplatform.common.exception.ModelNotFoundException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

/**
 * Loads {@link LinearModelArtifact}s from {@code <directory>/<entry.artifact>}.
 *
 * <p>A missing file is {@code ModelNotFound}; an unreadable file, or one whose coefficients
 * reference features the catalog does not require, is {@code ModelLoadFailure}.
 */
public class JsonModelArtifactLoader implements ModelArtifactLoader {

    private static final Logger log = LoggerFactory.getLogger(JsonModelArtifactLoader.class);

    private final Path directory;
    private final ObjectMapper mapper;

    public JsonModelArtifactLoader(Path directory, ObjectMapper mapper) {
        this.directory = directory;
        this.mapper = mapper;
    }

    @Override
    public ModelArtifact load(ModelCatalogEntry entry) {
        if (entry.artifact() == null || entry.artifact().isBlank()) {
            throw new ModelNotFoundException(entry.id(), "no artifact declared");
        }
        Path file = directory.resolve(entry.artifact()).normalize();
        if (!Files.isRegularFile(file)) {
            throw new ModelNotFoundException(entry.id(), "artifact " + file + " does not exist");
        }

        LinearModelArtifact artifact;
        try {
            artifact = mapper.readValue(file.toFile(), LinearModelArtifact.class);
        } catch (IOException e) {
            throw new ModelLoadFailureException(entry.id(), "artifact " + file + " is unreadable", e);
        }

        Set<String> unknown = new HashSet<>(artifact.coefficients().keySet());
        unknown.removeAll(entry.requiredFeatures());
        if (!unknown.isEmpty()) {
            throw new ModelLoadFailureException(entry.id(),
                "coefficients reference undeclared features " + unknown, null);
        }

        log.info("[ModelLoader] Loaded modelId={} file={} coefficients={} link={}",
                 entry.id(), file.getFileName(), artifact.coefficients().size(), artifact.link());
        return artifact;
    }
}
