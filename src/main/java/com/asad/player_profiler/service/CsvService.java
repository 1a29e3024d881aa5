package com.asad.player_profiler.service;

import com.asad.player_profiler.exception.ProfilingException;
import com.asad.player_profiler.model.CountingStat;
import com.asad.player_profiler.model.RawRecord;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * Reads raw stat lines, one per player per game. Columns are matched by header name:
 * {@code player_id, player_name, game_id, minutes} plus one column per {@link CountingStat}.
 * Blank cells become null; shot-zone columns may be absent entirely.
 */
@Slf4j
@Service
public class CsvService {

    public List<RawRecord> parse(InputStream in) {
        List<RawRecord> records = new ArrayList<>();
        int skipped = 0;

        try (CSVReader reader = new CSVReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String[] header = reader.readNext();
            if (header == null) return records;

            Map<String, Integer> index = indexHeader(header);
            if (!index.containsKey("player_id") || !index.containsKey("minutes")) {
                throw new ProfilingException("CSV header must contain player_id and minutes, got " + Arrays.toString(header));
            }

            String[] row;
            int line = 1;
            while ((row = reader.readNext()) != null) {
                line++;
                if (row.length == 1 && row[0].isBlank()) continue;

                try {
                    records.add(toRecord(row, index));
                } catch (NumberFormatException ex) {
                    skipped++;
                    log.warn("Skipping CSV line {}: {}", line, ex.getMessage());
                }
            }
        } catch (IOException | CsvValidationException ex) {
            throw new ProfilingException("CSV parse failed: " + ex.getMessage(), ex);
        }

        log.info("Parsed {} raw records ({} unparseable lines skipped)", records.size(), skipped);
        return records;
    }

    private static Map<String, Integer> indexHeader(String[] header) {
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < header.length; i++) {
            String name = header[i].trim().toLowerCase(Locale.ROOT);
            // BOM from spreadsheet exports
            if (i == 0 && name.startsWith("\uFEFF")) name = name.substring(1);
            index.put(name, i);
        }
        return index;
    }

    private static RawRecord toRecord(String[] row, Map<String, Integer> index) {
        Map<CountingStat, Integer> stats = new EnumMap<>(CountingStat.class);
        for (CountingStat stat : CountingStat.values()) {
            stats.put(stat, parseInt(cell(row, index, stat.column())));
        }

        return RawRecord.builder()
                .playerId(cell(row, index, "player_id"))
                .playerName(cell(row, index, "player_name"))
                .gameId(cell(row, index, "game_id"))
                .minutes(parseMinutes(cell(row, index, "minutes")))
                .points(stats.get(CountingStat.POINTS))
                .assists(stats.get(CountingStat.ASSISTS))
                .offensiveRebounds(stats.get(CountingStat.OFFENSIVE_REBOUNDS))
                .defensiveRebounds(stats.get(CountingStat.DEFENSIVE_REBOUNDS))
                .steals(stats.get(CountingStat.STEALS))
                .blocks(stats.get(CountingStat.BLOCKS))
                .turnovers(stats.get(CountingStat.TURNOVERS))
                .personalFouls(stats.get(CountingStat.PERSONAL_FOULS))
                .fieldGoalsMade(stats.get(CountingStat.FIELD_GOALS_MADE))
                .fieldGoalsAttempted(stats.get(CountingStat.FIELD_GOALS_ATTEMPTED))
                .threePointersMade(stats.get(CountingStat.THREE_POINTERS_MADE))
                .threePointersAttempted(stats.get(CountingStat.THREE_POINTERS_ATTEMPTED))
                .freeThrowsMade(stats.get(CountingStat.FREE_THROWS_MADE))
                .freeThrowsAttempted(stats.get(CountingStat.FREE_THROWS_ATTEMPTED))
                .interiorMade(stats.get(CountingStat.INTERIOR_MADE))
                .interiorAttempted(stats.get(CountingStat.INTERIOR_ATTEMPTED))
                .exteriorMade(stats.get(CountingStat.EXTERIOR_MADE))
                .exteriorAttempted(stats.get(CountingStat.EXTERIOR_ATTEMPTED))
                .build();
    }

    private static String cell(String[] row, Map<String, Integer> index, String column) {
        Integer i = index.get(column);
        if (i == null || i >= row.length) return null;
        String v = row[i].trim();
        return v.isEmpty() ? null : v;
    }

    private static Integer parseInt(String v) {
        if (v == null) return null;
        // exports sometimes write counts as "12.0"
        if (v.endsWith(".0")) v = v.substring(0, v.length() - 2);
        return Integer.parseInt(v);
    }

    /** Decimal minutes, or "MM:SS" as box scores print them. */
    static Double parseMinutes(String v) {
        if (v == null) return null;
        if (v.contains(":")) {
            String[] t = v.split(":");
            if (t.length != 2) throw new NumberFormatException("bad minutes \"" + v + "\"");
            int mm = Integer.parseInt(t[0].trim());
            int ss = Integer.parseInt(t[1].trim());
            return mm + ss / 60.0;
        }
        return Double.parseDouble(v);
    }
}
