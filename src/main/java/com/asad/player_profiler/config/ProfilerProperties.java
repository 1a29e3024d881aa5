package com.asad.player_profiler.config;

import com.asad.player_profiler.model.ScalerType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "profiler")
@Data
@Validated
public class ProfilerProperties {

    @Valid
    private Features features = new Features();
    @Valid
    private Filter filter = new Filter();
    @Valid
    private Scaler scaler = new Scaler();
    @Valid
    private Clustering clustering = new Clustering();
    @Valid
    private Stability stability = new Stability();
    @Valid
    private Parallelism parallelism = new Parallelism();
    private Batch batch = new Batch();

    @Data
    public static class Features {
        // rate features are per this many minutes
        @Positive
        private double exposureMinutes = 36.0;

        // POSS = FGA + factor * FTA - ORB + TOV
        @Positive
        private double freeThrowPossessionFactor = 0.44;

        // OER = multiplier * PTS / POSS
        @Positive
        private double efficiencyMultiplier = 100.0;

        // DER = stl*stl36 + blk*blk36 + drb*drb36 + pf*pf36, applied as configured
        private double defensiveStealWeight = 2.0;
        private double defensiveBlockWeight = 2.0;
        private double defensiveReboundWeight = 1.0;
        private double defensiveFoulWeight = -0.5;

        // auxiliary features correlated above this with a clustering feature stay excluded
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double correlationCutoff = 0.6;
    }

    @Data
    public static class Filter {
        @Min(1)
        private int minGames = 5;

        @DecimalMin("0.0")
        private double minMinutes = 0.0;

        private boolean excludeLowExposure = true;
    }

    @Data
    public static class Scaler {
        @NotNull
        private ScalerType type = ScalerType.STANDARD;
    }

    @Data
    public static class Clustering {
        @Min(2)
        private int minK = 2;

        @Min(2)
        private int maxK = 12;

        private long seed = 42L;

        @Min(1)
        private int maxIterations = 300;

        @Min(1)
        private int restarts = 10;

        // below this the selection is logged as weak structure, not rejected
        @DecimalMin("-1.0")
        @DecimalMax("1.0")
        private double acceptableSilhouette = 0.1;
    }

    @Data
    public static class Stability {
        @Min(2)
        private int repetitions = 50;

        // explicit seeds; when empty, seed+1 .. seed+repetitions
        private List<Long> seeds = new ArrayList<>();

        @DecimalMin("-1.0")
        @DecimalMax("1.0")
        private double threshold = 0.9;

        private boolean keepRunLabels = false;
    }

    @Data
    public static class Parallelism {
        @Min(1)
        private int threads = Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    @Data
    public static class Batch {
        // CSV of raw records; the batch runner stays idle when unset
        private String input;
        private String outputDir = "output";
    }
}
