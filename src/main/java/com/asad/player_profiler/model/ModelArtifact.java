package com.asad.player_profiler.model;

import java.util.List;

/**
 * What must be persisted to score future players against a fitted model without refitting.
 */
public record ModelArtifact(
        int k,
        double silhouette,
        boolean converged,
        long seed,
        List<String> columns,
        double[][] centroids,
        ScalerParameters scaler
) {

    public static ModelArtifact of(ClusterModel model, ScalerParameters scaler) {
        return new ModelArtifact(model.k(), model.silhouette(), model.converged(), model.seed(),
                scaler.columns(), model.centroids(), scaler);
    }

    public ClusterModel toModel() {
        return new ClusterModel(k, centroids, silhouette, 0.0, 0, converged, seed);
    }
}
