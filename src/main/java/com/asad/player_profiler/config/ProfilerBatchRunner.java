package com.asad.player_profiler.config;

import com.asad.player_profiler.exception.ProfilingException;
import com.asad.player_profiler.model.PipelineResult;
import com.asad.player_profiler.model.RawRecord;
import com.asad.player_profiler.service.CsvService;
import com.asad.player_profiler.service.ProfilingPipelineService;
import com.asad.player_profiler.service.ResultExportService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Batch mode: with {@code profiler.batch.input} set, profiles that CSV once at start-up
 * and writes the outputs to {@code profiler.batch.output-dir}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProfilerBatchRunner implements ApplicationRunner {

    private final ProfilerProperties properties;
    private final CsvService csvService;
    private final ProfilingPipelineService pipelineService;
    private final ResultExportService exportService;

    @Override
    public void run(ApplicationArguments args) {
        String input = properties.getBatch().getInput();
        if (input == null || input.isBlank()) return;

        Path source = Path.of(input);
        log.info("Batch profiling {}", source.toAbsolutePath());

        List<RawRecord> records;
        try (InputStream in = Files.newInputStream(source)) {
            records = csvService.parse(in);
        } catch (IOException ex) {
            throw new ProfilingException("cannot read batch input " + source, ex);
        }

        PipelineResult result = pipelineService.run(records);
        exportService.exportAll(result, Path.of(properties.getBatch().getOutputDir()));
    }
}
