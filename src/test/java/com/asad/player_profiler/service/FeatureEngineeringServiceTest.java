package com.asad.player_profiler.service;

import com.asad.player_profiler.PlayerFixtures;
import com.asad.player_profiler.config.ProfilerProperties;
import com.asad.player_profiler.exception.InvalidAggregateException;
import com.asad.player_profiler.model.*;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static com.asad.player_profiler.PlayerFixtures.line;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class FeatureEngineeringServiceTest {

    private final AggregationService aggregation = new AggregationService();
    private final FeatureEngineeringService service = new FeatureEngineeringService(new ProfilerProperties());

    private PlayerAggregate aggregate(RawRecord... records) {
        return aggregation.aggregate(List.of(records)).list().get(0);
    }

    @Test
    void ratesArePer36Minutes() {
        PlayerAggregate p = aggregate(
                line("p1", "G1", 20.0, 10, 2, 1, 3, 1, 0, 2, 1, 4, 9, 1, 3, 1, 2),
                line("p1", "G2", 16.0, 20, 4, 0, 5, 2, 1, 1, 3, 8, 15, 2, 5, 2, 2));

        FeatureVector v = service.engineer(p);

        assertThat(v.ptsPer36()).isEqualTo(30.0);
        assertThat(v.astPer36()).isEqualTo(6.0);
        assertThat(v.trbPer36()).isEqualTo(9.0);
        assertThat(v.fgaPer36()).isEqualTo(24.0);
        assertThat(v.threePaPer36()).isEqualTo(8.0);
        assertThat(v.twoPaPer36()).isEqualTo(16.0);
        assertThat(v.lowExposure()).isFalse();
    }

    @Test
    void shootingPercentagesAndShares() {
        // 10 FGA of which 4 threes; 5 FGM of which 1 three; 4 of 5 FT
        PlayerAggregate p = aggregate(line("p1", "G1", 30.0, 15, 0, 2, 4, 0, 0, 3, 2, 5, 10, 1, 4, 4, 5));

        FeatureVector v = service.engineer(p);

        assertThat(v.fg2Pct()).isCloseTo(4.0 / 6.0, within(1e-12));
        assertThat(v.fg3Pct()).isCloseTo(0.25, within(1e-12));
        assertThat(v.ftPct()).isCloseTo(0.8, within(1e-12));
        assertThat(v.usage2p()).isCloseTo(0.6, within(1e-12));
        assertThat(v.usage3p()).isCloseTo(0.4, within(1e-12));
        assertThat(v.trueShootingPct()).isCloseTo(15.0 / (2 * (10 + 0.44 * 5)), within(1e-12));
    }

    @Test
    void efficiencyIndices() {
        PlayerAggregate p = aggregate(line("p1", "G1", 36.0, 20, 5, 2, 6, 2, 1, 3, 4, 8, 15, 2, 5, 2, 5));

        FeatureVector v = service.engineer(p);

        double possessions = 15 + 0.44 * 5 - 2 + 3;
        assertThat(v.oer()).isCloseTo(100.0 * 20 / possessions, within(1e-9));
        assertThat(v.der()).isCloseTo(2.0 * 2 + 2.0 * 1 + 1.0 * 6 - 0.5 * 4, within(1e-9));
    }

    @Test
    void zeroMinutesGivesZeroRatesAndFlagsLowExposure() {
        PlayerAggregate p = aggregate(line("bench", "G1", 0.0, 2, 1, 1, 1, 1, 1, 1, 1, 1, 2, 0, 0, 0, 0));

        FeatureVector v = service.engineer(p);

        assertThat(v.lowExposure()).isTrue();
        assertThat(v.ptsPer36()).isZero();
        assertThat(v.trbPer36()).isZero();
        assertThat(v.der()).isZero();
        assertThat(v.clusteringValues()).doesNotContain(Double.NaN, Double.POSITIVE_INFINITY);
    }

    @Test
    void noAttemptsGivesZeroPercentages() {
        PlayerAggregate p = aggregate(line("p1", "G1", 12.0, 0, 3, 1, 2, 1, 0, 1, 2, 0, 0, 0, 0, 0, 0));

        FeatureVector v = service.engineer(p);

        assertThat(v.fg2Pct()).isZero();
        assertThat(v.fg3Pct()).isZero();
        assertThat(v.ftPct()).isZero();
        assertThat(v.usage2p()).isZero();
        assertThat(v.usage3p()).isZero();
        assertThat(v.trueShootingPct()).isZero();
        assertThat(v.oer()).isZero();
    }

    @Test
    void inconsistentTotalsAreClampedToUnitInterval() {
        // more makes than attempts
        PlayerAggregate p = aggregate(line("p1", "G1", 20.0, 10, 0, 0, 0, 0, 0, 0, 0, 5, 3, 0, 0, 0, 0));

        FeatureVector v = service.engineer(p);

        assertThat(v.fg2Pct()).isEqualTo(1.0);
        for (ClusteringFeature f : ClusteringFeature.values()) {
            if (f.bounded()) assertThat(v.value(f)).isBetween(0.0, 1.0);
        }
    }

    @Test
    void missingRequiredStatIsRejected() {
        Map<CountingStat, Integer> totals = new EnumMap<>(CountingStat.class);
        for (CountingStat s : CountingStat.values()) totals.put(s, 1);
        PlayerAggregate p = new PlayerAggregate("p1", "P1", 3, 60.0, totals,
                EnumSet.of(CountingStat.STEALS, CountingStat.INTERIOR_MADE));

        assertThatThrownBy(() -> service.engineer(p))
                .isInstanceOf(InvalidAggregateException.class)
                .satisfies(ex -> {
                    InvalidAggregateException iae = (InvalidAggregateException) ex;
                    assertThat(iae.getPlayerId()).isEqualTo("p1");
                    assertThat(iae.getMissing()).containsExactly(CountingStat.STEALS);
                });
    }

    @Test
    void shotZonesAreZeroWhenNotReported() {
        FeatureVector v = service.engineer(aggregate(line("p1", "G1", 30.0, 10, 1, 1, 1, 1, 1, 1, 1, 4, 8, 0, 2, 2, 2)));

        assertThat(v.interiorPct()).isZero();
        assertThat(v.exteriorFreq()).isZero();
    }

    @Test
    void shotZonesWhenReported() {
        RawRecord r = RawRecord.builder()
                .playerId("p1").gameId("G1").minutes(30.0)
                .points(10).assists(1).offensiveRebounds(1).defensiveRebounds(1)
                .steals(1).blocks(1).turnovers(1).personalFouls(1)
                .fieldGoalsMade(4).fieldGoalsAttempted(10).threePointersMade(1).threePointersAttempted(4)
                .freeThrowsMade(1).freeThrowsAttempted(2)
                .interiorMade(3).interiorAttempted(4).exteriorMade(1).exteriorAttempted(6)
                .build();

        FeatureVector v = service.engineer(aggregate(r));

        assertThat(v.interiorPct()).isCloseTo(0.75, within(1e-12));
        assertThat(v.interiorFreq()).isCloseTo(0.4, within(1e-12));
        assertThat(v.exteriorPct()).isCloseTo(1.0 / 6.0, within(1e-12));
        assertThat(v.exteriorFreq()).isCloseTo(0.6, within(1e-12));
    }

    @Test
    void clusteringValuesFollowFeatureOrder() {
        FeatureVector v = service.engineer(aggregate(line("p1", "G1", 30.0, 10, 1, 1, 1, 1, 1, 1, 1, 4, 8, 0, 2, 2, 2)));

        double[] values = v.clusteringValues();
        assertThat(values).hasSize(ClusteringFeature.COUNT);
        assertThat(values[ClusteringFeature.OER.ordinal()]).isEqualTo(v.oer());
        assertThat(values[ClusteringFeature.PF_PER36.ordinal()]).isEqualTo(v.pfPer36());
    }

    @Test
    void constantAuxiliaryFeaturesPassTheScreen() {
        List<FeatureVector> population = new ArrayList<>();
        for (PlayerAggregate p : aggregation.aggregate(PlayerFixtures.archetypeLeague(5, 1)).list()) {
            population.add(service.engineer(p));
        }

        List<CorrelationScreen> screen = service.screenAuxiliary(population, 0.6);

        assertThat(screen).hasSize(AuxiliaryFeature.values().length);
        assertThat(screen).allSatisfy(s -> {
            assertThat(s.correlation()).isZero();
            assertThat(s.excluded()).isFalse();
        });
    }

    private static List<FeatureVector> interiorTracksTwoPointShooting() {
        List<FeatureVector> population = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            double fg2 = 0.35 + 0.03 * i;
            population.add(FeatureVector.builder()
                    .playerId("p" + i)
                    .gamesPlayed(10)
                    .minutes(300.0)
                    .ptsPer36(10.0 + (i % 3) * 4.0)
                    .fg2Pct(fg2)
                    .interiorPct(fg2 + (i % 2 == 0 ? 0.01 : -0.01))
                    .interiorFreq(0.5)
                    .build());
        }
        return population;
    }

    @Test
    void auxiliaryFeatureAboveCutoffIsExcluded() {
        List<CorrelationScreen> screen = service.screenAuxiliary(interiorTracksTwoPointShooting(), 0.6);

        CorrelationScreen interiorPct = screen.stream()
                .filter(s -> s.feature() == AuxiliaryFeature.INTERIOR_PCT)
                .findFirst().orElseThrow();
        assertThat(interiorPct.excluded()).isTrue();
        assertThat(interiorPct.closest()).isEqualTo(ClusteringFeature.FG2_PCT);
        assertThat(interiorPct.correlation()).isGreaterThan(0.95);

        CorrelationScreen interiorFreq = screen.stream()
                .filter(s -> s.feature() == AuxiliaryFeature.INTERIOR_FREQ)
                .findFirst().orElseThrow();
        assertThat(interiorFreq.excluded()).isFalse();
    }

    @Test
    void cutoffDecidesExclusion() {
        List<CorrelationScreen> screen = service.screenAuxiliary(interiorTracksTwoPointShooting(), 1.0);

        assertThat(screen).noneMatch(CorrelationScreen::excluded);
    }
}
