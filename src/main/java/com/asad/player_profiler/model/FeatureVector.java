package com.asad.player_profiler.model;

import lombok.Builder;

/**
 * Engineered features of one player: the 20 clustering columns (see {@link ClusteringFeature})
 * plus the auxiliary EDA columns (see {@link AuxiliaryFeature}) which never reach the model.
 */
@Builder
public record FeatureVector(
        String playerId,
        String playerName,
        int gamesPlayed,
        double minutes,
        boolean lowExposure,

        // per-36 rates
        double ptsPer36,
        double astPer36,
        double trbPer36,
        double stlPer36,
        double blkPer36,
        double tovPer36,
        double fgaPer36,
        double threePaPer36,
        double twoPaPer36,

        // shooting
        double fg2Pct,
        double fg3Pct,
        double ftPct,
        double usage2p,
        double usage3p,

        // composite indices
        double oer,
        double der,
        double trueShootingPct,

        double orbPer36,
        double drbPer36,
        double pfPer36,

        // EDA only
        double interiorPct,
        double interiorFreq,
        double exteriorPct,
        double exteriorFreq
) {

    /** Clustering columns in {@link ClusteringFeature} order. */
    public double[] clusteringValues() {
        ClusteringFeature[] features = ClusteringFeature.values();
        double[] out = new double[features.length];
        for (int i = 0; i < features.length; i++) {
            out[i] = features[i].of(this);
        }
        return out;
    }

    public double value(ClusteringFeature feature) {
        return feature.of(this);
    }

    public double value(AuxiliaryFeature feature) {
        return feature.of(this);
    }
}
