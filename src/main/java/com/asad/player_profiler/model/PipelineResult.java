package com.asad.player_profiler.model;

import java.util.List;

/**
 * Everything one pipeline run produced. Lists share the same player order.
 */
public record PipelineResult(
        List<PlayerAggregate> aggregates,
        List<FeatureVector> features,
        List<CorrelationScreen> correlationScreen,
        ScalerParameters scaler,
        List<ScaledFeatureVector> scaled,
        ModelSelection selection,
        ClusterModel model,
        List<ClusterAssignment> assignments,
        PcaResult pca,
        StabilityReport stability,
        int skippedRecords,
        int excludedPlayers
) {}
