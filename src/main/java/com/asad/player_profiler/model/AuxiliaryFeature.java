package com.asad.player_profiler.model;

import java.util.function.ToDoubleFunction;

/**
 * Shot-zone features kept for exploration only. They overlap heavily with
 * fg2_pct / fg3_pct / usage shares and are never part of the clustering matrix.
 */
public enum AuxiliaryFeature {

    INTERIOR_PCT("interior_pct", FeatureVector::interiorPct),
    INTERIOR_FREQ("interior_freq", FeatureVector::interiorFreq),
    EXTERIOR_PCT("exterior_pct", FeatureVector::exteriorPct),
    EXTERIOR_FREQ("exterior_freq", FeatureVector::exteriorFreq);

    private final String column;
    private final ToDoubleFunction<FeatureVector> accessor;

    AuxiliaryFeature(String column, ToDoubleFunction<FeatureVector> accessor) {
        this.column = column;
        this.accessor = accessor;
    }

    public String column() {
        return column;
    }

    public double of(FeatureVector v) {
        return accessor.applyAsDouble(v);
    }
}
