package com.asad.player_profiler.model;

import java.util.Arrays;

/**
 * A player's clustering columns after scaling, same order as {@link ClusteringFeature}.
 */
public record ScaledFeatureVector(String playerId, double[] values) {

    public ScaledFeatureVector {
        if (values == null || values.length != ClusteringFeature.COUNT) {
            throw new IllegalArgumentException("expected " + ClusteringFeature.COUNT + " scaled values for "
                    + playerId + ", got " + (values == null ? "null" : values.length));
        }
        values = values.clone();
    }

    @Override
    public double[] values() {
        return values.clone();
    }

    public double value(ClusteringFeature feature) {
        return values[feature.ordinal()];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScaledFeatureVector other)) return false;
        return playerId.equals(other.playerId) && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * playerId.hashCode() + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "ScaledFeatureVector[" + playerId + ", " + Arrays.toString(values) + "]";
    }
}
