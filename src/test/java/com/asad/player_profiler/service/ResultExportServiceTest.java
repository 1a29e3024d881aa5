package com.asad.player_profiler.service;

import com.asad.player_profiler.PlayerFixtures;
import com.asad.player_profiler.config.ProfilerProperties;
import com.asad.player_profiler.model.ClusterModel;
import com.asad.player_profiler.model.ModelArtifact;
import com.asad.player_profiler.model.PipelineResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opencsv.CSVReader;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class ResultExportServiceTest {

    private static PipelineResult result;

    private final ObjectMapper mapper = new ObjectMapper();
    private final ResultExportService service = new ResultExportService(mapper);

    @TempDir
    Path dir;

    @BeforeAll
    static void runPipeline() {
        ProfilerProperties properties = PlayerFixtures.testProperties();
        properties.getStability().setRepetitions(3);
        KMeansClusterer clusterer = new KMeansClusterer(properties);
        TaskFanOut fanOut = new TaskFanOut(properties);
        ProfilingPipelineService pipeline = new ProfilingPipelineService(
                new AggregationService(),
                new FeatureEngineeringService(properties),
                new ScalerService(properties),
                new ModelSelectionService(clusterer, fanOut, properties),
                clusterer,
                new PcaService(),
                new StabilityService(clusterer, fanOut, properties),
                properties);
        result = pipeline.run(PlayerFixtures.archetypeLeague(6, 2));
    }

    @Test
    void writesAllThreeOutputs() throws Exception {
        Path out = dir.resolve("run");

        service.exportAll(result, out);

        assertThat(out.resolve(ResultExportService.ASSIGNMENTS_FILE)).exists();
        assertThat(out.resolve(ResultExportService.MODEL_FILE)).exists();
        assertThat(out.resolve(ResultExportService.STABILITY_FILE)).exists();
        try (Stream<Path> files = Files.list(out)) {
            assertThat(files).noneMatch(p -> p.getFileName().toString().endsWith(".tmp"));
        }
    }

    @Test
    void assignmentTableHasOneRowPerPlayer() throws Exception {
        Path target = dir.resolve("assignments.csv");

        service.writeAssignments(result, target);

        List<String[]> rows;
        try (Reader in = Files.newBufferedReader(target); CSVReader reader = new CSVReader(in)) {
            rows = reader.readAll();
        }
        String[] header = rows.get(0);
        assertThat(header[0]).isEqualTo("player_id");
        assertThat(header).contains("oer", "oer_scaled", "cluster", "distance");
        assertThat(rows).hasSize(1 + result.assignments().size());

        int clusterCol = List.of(header).indexOf("cluster");
        for (int i = 1; i < rows.size(); i++) {
            assertThat(rows.get(i)[0]).isEqualTo(result.assignments().get(i - 1).playerId());
            assertThat(Integer.parseInt(rows.get(i)[clusterCol])).isEqualTo(result.assignments().get(i - 1).label());
        }
    }

    @Test
    void modelArtifactRoundTripsAndScoresLikeTheFittedModel() {
        Path target = dir.resolve("model.json");
        service.writeJson(ModelArtifact.of(result.model(), result.scaler()), target);

        ModelArtifact artifact = service.readModel(target);
        ClusterModel model = artifact.toModel();

        assertThat(artifact.k()).isEqualTo(result.model().k());
        assertThat(artifact.scaler()).isEqualTo(result.scaler());
        assertThat(artifact.columns()).isEqualTo(result.scaler().columns());
        for (int i = 0; i < result.features().size(); i++) {
            double[] scaled = artifact.scaler().transform(result.features().get(i).clusteringValues());
            assertThat(model.nearest(scaled)).isEqualTo(result.assignments().get(i).label());
        }
    }

    @Test
    void stabilityReportIsJson() throws Exception {
        Path target = dir.resolve("stability.json");

        service.writeJson(result.stability(), target);

        JsonNode json = mapper.readTree(target.toFile());
        assertThat(json.get("k").asInt()).isEqualTo(result.model().k());
        assertThat(json.get("stable").asBoolean()).isEqualTo(result.stability().stable());
        assertThat(json.get("seeds").size()).isEqualTo(3);
    }
}
