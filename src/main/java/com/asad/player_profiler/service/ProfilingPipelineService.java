package com.asad.player_profiler.service;

import com.asad.player_profiler.config.ProfilerProperties;
import com.asad.player_profiler.exception.DegenerateInputException;
import com.asad.player_profiler.exception.InvalidAggregateException;
import com.asad.player_profiler.exception.PipelineAbortedException;
import com.asad.player_profiler.model.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Runs one batch from raw records to profiles. Each stage finishes before the next starts;
 * the run can be aborted between stages by interrupting the calling thread.
 */
@Slf4j
@Service
public class ProfilingPipelineService {

    private static final int PROJECTION_COMPONENTS = 2;

    private final AggregationService aggregationService;
    private final FeatureEngineeringService featureService;
    private final ScalerService scalerService;
    private final ModelSelectionService selectionService;
    private final KMeansClusterer clusterer;
    private final PcaService pcaService;
    private final StabilityService stabilityService;
    private final ProfilerProperties properties;

    public ProfilingPipelineService(AggregationService aggregationService,
                                    FeatureEngineeringService featureService,
                                    ScalerService scalerService,
                                    ModelSelectionService selectionService,
                                    KMeansClusterer clusterer,
                                    PcaService pcaService,
                                    StabilityService stabilityService,
                                    ProfilerProperties properties) {
        this.aggregationService = aggregationService;
        this.featureService = featureService;
        this.scalerService = scalerService;
        this.selectionService = selectionService;
        this.clusterer = clusterer;
        this.pcaService = pcaService;
        this.stabilityService = stabilityService;
        this.properties = properties;
    }

    public PipelineResult run(List<RawRecord> records) {
        ProfilerProperties.Filter filter = properties.getFilter();
        ProfilerProperties.Clustering clustering = properties.getClustering();
        long seed = clustering.getSeed();

        log.info("Profiling run started: {} raw records", records.size());

        // 1) aggregate
        AggregationService.AggregationResult aggregated = aggregationService.aggregate(records);
        List<PlayerAggregate> players = aggregationService.filter(
                aggregated.players().values(), filter.getMinGames(), filter.getMinMinutes());
        checkpoint("aggregation");

        // 2) features
        List<PlayerAggregate> kept = new ArrayList<>();
        List<FeatureVector> features = new ArrayList<>();
        int excluded = 0;
        for (PlayerAggregate p : players) {
            FeatureVector v;
            try {
                v = featureService.engineer(p);
            } catch (InvalidAggregateException ex) {
                excluded++;
                log.warn("Excluding player: {}", ex.getMessage());
                continue;
            }
            if (v.lowExposure() && filter.isExcludeLowExposure()) {
                excluded++;
                log.warn("Excluding low-exposure player {} (0 minutes)", p.playerId());
                continue;
            }
            kept.add(p);
            features.add(v);
        }
        if (features.isEmpty()) {
            throw new DegenerateInputException("no players left to profile after filtering ("
                    + aggregated.players().size() + " aggregated, " + excluded + " excluded)");
        }
        if (features.size() < clustering.getMinK()) {
            throw new DegenerateInputException(features.size() + " players is fewer than the smallest candidate K "
                    + clustering.getMinK());
        }
        List<CorrelationScreen> screen = featureService.screenAuxiliary(
                features, properties.getFeatures().getCorrelationCutoff());
        checkpoint("feature engineering");

        // 3) scale
        ScalerParameters scaler = scalerService.fit(features);
        List<ScaledFeatureVector> scaled = scalerService.transform(scaler, features);
        double[][] matrix = ScalerService.scaledMatrix(scaled);
        checkpoint("scaling");

        // 4) select K, final fit
        ModelSelection selection = selectionService.select(matrix, clustering.getMinK(), clustering.getMaxK(), seed);
        checkpoint("model selection");

        KMeansClusterer.KMeansFit fit = clusterer.fit(matrix, selection.selectedK(), seed);
        ClusterModel model = new ClusterModel(
                fit.k(), fit.centroids(), selection.selectedScore(), fit.inertia(),
                fit.iterations(), fit.converged(), seed);

        int[] labels = fit.labels();
        double[] distances = fit.distances();
        List<ClusterAssignment> assignments = new ArrayList<>(scaled.size());
        for (int i = 0; i < scaled.size(); i++) {
            assignments.add(new ClusterAssignment(scaled.get(i).playerId(), labels[i], distances[i]));
        }
        checkpoint("clustering");

        // 5) projection, stability
        PcaResult pca = pcaService.analyze(matrix, ids(scaled), PROJECTION_COMPONENTS);
        checkpoint("projection");

        StabilityReport stability = stabilityService.validate(matrix, model.k(), seed, labels);

        log.info("Profiling run finished: {} players, K={}, silhouette={}, stable={}",
                features.size(), model.k(), String.format(Locale.ROOT, "%.4f", model.silhouette()), stability.stable());

        return new PipelineResult(kept, features, screen, scaler, scaled, selection, model, assignments,
                pca, stability, aggregated.skippedRecords(), excluded);
    }

    /** Assigns a new player to an existing model without refitting anything. */
    public ClusterAssignment score(ClusterModel model, ScalerParameters scaler, FeatureVector player) {
        double[] scaled = scaler.transform(player.clusteringValues());
        int label = model.nearest(scaled);
        return new ClusterAssignment(player.playerId(), label, model.distanceTo(label, scaled));
    }

    private static List<String> ids(List<ScaledFeatureVector> rows) {
        List<String> out = new ArrayList<>(rows.size());
        for (ScaledFeatureVector r : rows) out.add(r.playerId());
        return out;
    }

    private static void checkpoint(String stage) {
        if (Thread.currentThread().isInterrupted()) {
            throw new PipelineAbortedException("profiling aborted after " + stage);
        }
        log.debug("Checkpoint: {} done", stage);
    }
}
