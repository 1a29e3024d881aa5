package com.asad.player_profiler.service;

import com.asad.player_profiler.exception.ProfilingException;
import com.asad.player_profiler.model.*;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.opencsv.CSVWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Writes the three outputs of a run: assignment table (CSV), model artifact and stability report (JSON).
 * Each file is written to a temp sibling first and moved into place, so a failed run never
 * leaves a half-written output behind.
 */
@Slf4j
@Service
public class ResultExportService {

    public static final String ASSIGNMENTS_FILE = "player_assignments.csv";
    public static final String MODEL_FILE = "cluster_model.json";
    public static final String STABILITY_FILE = "stability_report.json";

    private final ObjectMapper mapper;

    public ResultExportService(ObjectMapper mapper) {
        this.mapper = mapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void exportAll(PipelineResult result, Path outputDir) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException ex) {
            throw new ProfilingException("cannot create output dir " + outputDir, ex);
        }
        writeAssignments(result, outputDir.resolve(ASSIGNMENTS_FILE));
        writeJson(ModelArtifact.of(result.model(), result.scaler()), outputDir.resolve(MODEL_FILE));
        writeJson(result.stability(), outputDir.resolve(STABILITY_FILE));
        log.info("Wrote profiling outputs to {}", outputDir.toAbsolutePath());
    }

    public void writeAssignments(PipelineResult result, Path target) {
        List<String> header = new ArrayList<>(List.of("player_id", "player_name"));
        for (String c : ClusteringFeature.columns()) header.add(c);
        for (String c : ClusteringFeature.columns()) header.add(c + "_scaled");
        header.add("cluster");
        header.add("distance");

        writeAtomically(target, out -> {
            try (CSVWriter writer = new CSVWriter(out)) {
                writer.writeNext(header.toArray(new String[0]));
                for (int i = 0; i < result.assignments().size(); i++) {
                    FeatureVector raw = result.features().get(i);
                    ScaledFeatureVector scaled = result.scaled().get(i);
                    ClusterAssignment a = result.assignments().get(i);

                    List<String> row = new ArrayList<>(header.size());
                    row.add(a.playerId());
                    row.add(raw.playerName() == null ? "" : raw.playerName());
                    for (double v : raw.clusteringValues()) row.add(num(v));
                    for (double v : scaled.values()) row.add(num(v));
                    row.add(Integer.toString(a.label()));
                    row.add(num(a.distance()));
                    writer.writeNext(row.toArray(new String[0]));
                }
            }
        });
    }

    public void writeJson(Object value, Path target) {
        writeAtomically(target, out -> mapper.writeValue(out, value));
    }

    public ModelArtifact readModel(Path source) {
        try {
            return mapper.readValue(source.toFile(), ModelArtifact.class);
        } catch (IOException ex) {
            throw new ProfilingException("cannot read model artifact " + source, ex);
        }
    }

    private interface WriterBody {
        void write(Writer out) throws IOException;
    }

    private static void writeAtomically(Path target, WriterBody body) {
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            try (Writer out = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                body.write(out);
            }
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException ex) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException cleanup) {
                ex.addSuppressed(cleanup);
            }
            throw new ProfilingException("cannot write " + target, ex);
        }
    }

    private static String num(double v) {
        return String.format(Locale.ROOT, "%.6f", v);
    }
}
