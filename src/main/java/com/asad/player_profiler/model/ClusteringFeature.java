package com.asad.player_profiler.model;

import java.util.function.ToDoubleFunction;

/**
 * The 20 columns of the clustering matrix, in matrix order.
 */
public enum ClusteringFeature {

    PTS_PER36("pts_per36", Kind.RATE, FeatureVector::ptsPer36),
    AST_PER36("ast_per36", Kind.RATE, FeatureVector::astPer36),
    TRB_PER36("trb_per36", Kind.RATE, FeatureVector::trbPer36),
    STL_PER36("stl_per36", Kind.RATE, FeatureVector::stlPer36),
    BLK_PER36("blk_per36", Kind.RATE, FeatureVector::blkPer36),
    TOV_PER36("tov_per36", Kind.RATE, FeatureVector::tovPer36),
    FGA_PER36("fga_per36", Kind.RATE, FeatureVector::fgaPer36),
    THREE_PA_PER36("3pa_per36", Kind.RATE, FeatureVector::threePaPer36),
    TWO_PA_PER36("2pa_per36", Kind.RATE, FeatureVector::twoPaPer36),
    FG2_PCT("fg2_pct", Kind.PERCENTAGE, FeatureVector::fg2Pct),
    FG3_PCT("fg3_pct", Kind.PERCENTAGE, FeatureVector::fg3Pct),
    FT_PCT("ft_pct", Kind.PERCENTAGE, FeatureVector::ftPct),
    USAGE_2P("usage_2p", Kind.SHARE, FeatureVector::usage2p),
    USAGE_3P("usage_3p", Kind.SHARE, FeatureVector::usage3p),
    OER("oer", Kind.INDEX, FeatureVector::oer),
    DER("der", Kind.INDEX, FeatureVector::der),
    TRUE_SHOOTING_PCT("true_shooting_pct", Kind.PERCENTAGE, FeatureVector::trueShootingPct),
    ORB_PER36("orb_per36", Kind.RATE, FeatureVector::orbPer36),
    DRB_PER36("drb_per36", Kind.RATE, FeatureVector::drbPer36),
    PF_PER36("pf_per36", Kind.RATE, FeatureVector::pfPer36);

    public enum Kind { RATE, PERCENTAGE, SHARE, INDEX }

    public static final int COUNT = values().length;

    private final String column;
    private final Kind kind;
    private final ToDoubleFunction<FeatureVector> accessor;

    ClusteringFeature(String column, Kind kind, ToDoubleFunction<FeatureVector> accessor) {
        this.column = column;
        this.kind = kind;
        this.accessor = accessor;
    }

    public String column() {
        return column;
    }

    public Kind kind() {
        return kind;
    }

    /** Percentages and shares must lie in [0,1]. */
    public boolean bounded() {
        return kind == Kind.PERCENTAGE || kind == Kind.SHARE;
    }

    public double of(FeatureVector v) {
        return accessor.applyAsDouble(v);
    }

    public static String[] columns() {
        ClusteringFeature[] all = values();
        String[] out = new String[all.length];
        for (int i = 0; i < all.length; i++) out[i] = all[i].column;
        return out;
    }
}
