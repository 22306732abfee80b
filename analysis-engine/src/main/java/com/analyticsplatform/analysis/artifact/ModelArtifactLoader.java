package com.analyticsplatform.analysis.artifact;

import com.analyticsplatform.analysis.model.ModelCatalogEntry;

/**
 * Turns a catalog entry into a usable artifact.
 *
 * <p>Implementations throw {@link com.analyticsplatform.common.exception.ModelNotFoundException}
 * when the artifact does not exist and
 * {@link com.analyticsplatform.common.exception.ModelLoadFailureException} when it exists but
 * cannot be read.
 */
public interface ModelArtifactLoader {
    ModelArtifact load(ModelCatalogEntry entry);
}
