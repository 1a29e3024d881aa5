package com.asad.player_profiler.model;

/**
 * Strongest correlation of an auxiliary feature with any clustering feature.
 * {@code excluded} when |r| is above the configured cutoff.
 */
public record CorrelationScreen(AuxiliaryFeature feature, ClusteringFeature closest, double correlation, boolean excluded) {}
