package com.asad.player_profiler.web;

import com.asad.player_profiler.exception.DegenerateInputException;
import com.asad.player_profiler.exception.ProfilingException;
import com.asad.player_profiler.model.*;
import com.asad.player_profiler.service.CsvService;
import com.asad.player_profiler.service.ProfilingPipelineService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
public class ProfileController {

    private final CsvService csvService;
    private final ProfilingPipelineService pipelineService;

    public ProfileController(CsvService csvService, ProfilingPipelineService pipelineService) {
        this.csvService = csvService;
        this.pipelineService = pipelineService;
    }

    /**
     * Upload raw stat lines (CSV), get the player profiles back.
     */
    @PostMapping(value = "/profile", produces = MediaType.APPLICATION_JSON_VALUE)
    public ProfileResponse profile(@RequestParam("file") MultipartFile file) throws IOException {
        List<RawRecord> records;
        try (InputStream in = file.getInputStream()) {
            records = csvService.parse(in);
        }

        PipelineResult result = pipelineService.run(records);
        StabilityReport stability = result.stability();

        return new ProfileResponse(
                result.model().k(),
                result.model().silhouette(),
                result.model().converged(),
                result.selection().scores(),
                result.assignments(),
                result.pca().explainedVarianceRatio(),
                result.pca().cumulativeVariance(),
                stability.meanAgreement(),
                stability.threshold(),
                stability.stable(),
                result.skippedRecords(),
                result.excludedPlayers()
        );
    }

    @ExceptionHandler(DegenerateInputException.class)
    public ResponseEntity<Map<String, String>> degenerate(DegenerateInputException ex) {
        log.warn("Profiling rejected: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(Map.of("error", ex.getMessage()));
    }

    @ExceptionHandler(ProfilingException.class)
    public ResponseEntity<Map<String, String>> failed(ProfilingException ex) {
        log.error("Profiling failed", ex);
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(Map.of("error", ex.getMessage()));
    }

    public record ProfileResponse(
            int selectedK,
            double silhouette,
            boolean converged,
            List<CandidateScore> candidates,
            List<ClusterAssignment> assignments,
            double[] explainedVariance,
            double[] cumulativeVariance,
            double stabilityAgreement,
            double stabilityThreshold,
            boolean stable,
            int skippedRecords,
            int excludedPlayers
    ) {}
}
