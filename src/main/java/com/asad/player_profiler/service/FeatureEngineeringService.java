package com.asad.player_profiler.service;

import com.asad.player_profiler.config.ProfilerProperties;
import com.asad.player_profiler.exception.InvalidAggregateException;
import com.asad.player_profiler.model.*;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.function.ToDoubleFunction;

import static com.asad.player_profiler.model.CountingStat.*;

/**
 * Turns season totals into the clustering features.
 *
 * <ul>
 *   <li>rates: total * exposure / minutes, 0 for a player with no minutes</li>
 *   <li>percentages and shares: made / attempted, 0 when nothing was attempted, clamped to [0,1]</li>
 *   <li>oer: multiplier * PTS / (FGA + f * FTA - ORB + TOV)</li>
 *   <li>der: weighted sum of stl, blk, drb and pf per-36 rates</li>
 *   <li>true shooting: PTS / (2 * (FGA + f * FTA))</li>
 * </ul>
 */
@Slf4j
@Service
public class FeatureEngineeringService {

    private final ProfilerProperties.Features config;

    public FeatureEngineeringService(ProfilerProperties properties) {
        this.config = properties.getFeatures();
    }

    public FeatureVector engineer(PlayerAggregate p) {
        EnumSet<CountingStat> missing = EnumSet.noneOf(CountingStat.class);
        for (CountingStat stat : CountingStat.values()) {
            if (stat.required() && !p.has(stat)) missing.add(stat);
        }
        if (!missing.isEmpty()) {
            throw new InvalidAggregateException(p.playerId(), missing);
        }

        double minutes = p.totalMinutes();
        boolean lowExposure = p.zeroExposure();
        double perExposure = lowExposure ? 0.0 : config.getExposureMinutes() / minutes;

        int pts = p.total(POINTS);
        int orb = p.total(OFFENSIVE_REBOUNDS);
        int drb = p.total(DEFENSIVE_REBOUNDS);
        int tov = p.total(TURNOVERS);
        int fga = p.total(FIELD_GOALS_ATTEMPTED);
        int fta = p.total(FREE_THROWS_ATTEMPTED);
        int threePa = p.total(THREE_POINTERS_ATTEMPTED);
        int twoPa = Math.max(0, fga - threePa);
        int twoPm = Math.max(0, p.total(FIELD_GOALS_MADE) - p.total(THREE_POINTERS_MADE));

        double stl36 = p.total(STEALS) * perExposure;
        double blk36 = p.total(BLOCKS) * perExposure;
        double drb36 = drb * perExposure;
        double pf36 = p.total(PERSONAL_FOULS) * perExposure;

        double f = config.getFreeThrowPossessionFactor();
        double possessions = fga + f * fta - orb + tov;
        double oer = possessions > 0 ? config.getEfficiencyMultiplier() * pts / possessions : 0.0;

        double der = config.getDefensiveStealWeight() * stl36
                + config.getDefensiveBlockWeight() * blk36
                + config.getDefensiveReboundWeight() * drb36
                + config.getDefensiveFoulWeight() * pf36;

        double tsAttempts = 2.0 * (fga + f * fta);

        boolean zones = p.has(INTERIOR_ATTEMPTED) && p.has(INTERIOR_MADE)
                && p.has(EXTERIOR_ATTEMPTED) && p.has(EXTERIOR_MADE);

        String id = p.playerId();
        return FeatureVector.builder()
                .playerId(id)
                .playerName(p.playerName())
                .gamesPlayed(p.gamesPlayed())
                .minutes(minutes)
                .lowExposure(lowExposure)
                .ptsPer36(pts * perExposure)
                .astPer36(p.total(ASSISTS) * perExposure)
                .trbPer36((orb + drb) * perExposure)
                .stlPer36(stl36)
                .blkPer36(blk36)
                .tovPer36(tov * perExposure)
                .fgaPer36(fga * perExposure)
                .threePaPer36(threePa * perExposure)
                .twoPaPer36(twoPa * perExposure)
                .fg2Pct(bounded(id, "fg2_pct", ratio(twoPm, twoPa)))
                .fg3Pct(bounded(id, "fg3_pct", ratio(p.total(THREE_POINTERS_MADE), threePa)))
                .ftPct(bounded(id, "ft_pct", ratio(p.total(FREE_THROWS_MADE), fta)))
                .usage2p(bounded(id, "usage_2p", ratio(twoPa, fga)))
                .usage3p(bounded(id, "usage_3p", ratio(threePa, fga)))
                .oer(oer)
                .der(der)
                .trueShootingPct(bounded(id, "true_shooting_pct", tsAttempts > 0 ? pts / tsAttempts : 0.0))
                .orbPer36(orb * perExposure)
                .drbPer36(drb36)
                .pfPer36(pf36)
                .interiorPct(zones ? bounded(id, "interior_pct", ratio(p.total(INTERIOR_MADE), p.total(INTERIOR_ATTEMPTED))) : 0.0)
                .interiorFreq(zones ? bounded(id, "interior_freq", ratio(p.total(INTERIOR_ATTEMPTED), fga)) : 0.0)
                .exteriorPct(zones ? bounded(id, "exterior_pct", ratio(p.total(EXTERIOR_MADE), p.total(EXTERIOR_ATTEMPTED))) : 0.0)
                .exteriorFreq(zones ? bounded(id, "exterior_freq", ratio(p.total(EXTERIOR_ATTEMPTED), fga)) : 0.0)
                .build();
    }

    /**
     * Correlates every auxiliary feature with every clustering feature over the population.
     * Constant columns correlate 0.
     */
    public List<CorrelationScreen> screenAuxiliary(List<FeatureVector> population, double cutoff) {
        List<CorrelationScreen> out = new ArrayList<>();
        if (population.size() < 2) return out;

        PearsonsCorrelation pearson = new PearsonsCorrelation();
        for (AuxiliaryFeature aux : AuxiliaryFeature.values()) {
            double[] a = column(population, aux::of);

            ClusteringFeature closest = null;
            double strongest = 0.0;
            for (ClusteringFeature feature : ClusteringFeature.values()) {
                double[] b = column(population, feature::of);
                double r = pearson.correlation(a, b);
                if (Double.isNaN(r)) r = 0.0;
                if (closest == null || Math.abs(r) > Math.abs(strongest)) {
                    closest = feature;
                    strongest = r;
                }
            }

            boolean excluded = Math.abs(strongest) > cutoff;
            out.add(new CorrelationScreen(aux, closest, strongest, excluded));
            if (!excluded) {
                log.info("Auxiliary feature {} stays below the {} cutoff (|r|={} with {})",
                        aux.column(), cutoff, String.format(Locale.ROOT, "%.2f", Math.abs(strongest)), closest.column());
            }
        }
        return out;
    }

    private static double[] column(List<FeatureVector> rows, ToDoubleFunction<FeatureVector> f) {
        double[] out = new double[rows.size()];
        for (int i = 0; i < out.length; i++) out[i] = f.applyAsDouble(rows.get(i));
        return out;
    }

    static double ratio(double numerator, double denominator) {
        return denominator > 0 ? numerator / denominator : 0.0;
    }

    private static double bounded(String playerId, String feature, double v) {
        if (v >= 0.0 && v <= 1.0) return v;
        log.warn("Player {}: {}={} outside [0, 1], clamped", playerId, feature, v);
        return Math.max(0.0, Math.min(1.0, v));
    }
}
