package com.asad.player_profiler.service;

import com.asad.player_profiler.exception.MissingIdentifierException;
import com.asad.player_profiler.model.CountingStat;
import com.asad.player_profiler.model.PlayerAggregate;
import com.asad.player_profiler.model.RawRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Folds per-game stat lines into one row per player.
 */
@Slf4j
@Service
public class AggregationService {

    public record AggregationResult(Map<String, PlayerAggregate> players, int recordsRead, int skippedRecords) {

        public List<PlayerAggregate> list() {
            return new ArrayList<>(players.values());
        }
    }

    // running totals for one player while the batch is folded
    private static class Totals {
        final String playerId;
        String playerName;
        int games;
        double minutes;
        final int[] sums = new int[CountingStat.values().length];
        final EnumSet<CountingStat> missing = EnumSet.noneOf(CountingStat.class);

        Totals(String playerId) {
            this.playerId = playerId;
        }

        void apply(RawRecord r) {
            if (playerName == null && r.playerName() != null) playerName = r.playerName();

            games++;
            if (r.minutes() != null && r.minutes() > 0) minutes += r.minutes();

            for (CountingStat stat : CountingStat.values()) {
                Integer v = stat.of(r);
                if (v == null) {
                    missing.add(stat);
                } else {
                    sums[stat.ordinal()] += v;
                }
            }
        }

        PlayerAggregate freeze() {
            Map<CountingStat, Integer> totals = new EnumMap<>(CountingStat.class);
            for (CountingStat stat : CountingStat.values()) {
                totals.put(stat, sums[stat.ordinal()]);
            }
            return new PlayerAggregate(playerId, playerName, games, minutes, totals, missing);
        }
    }

    /**
     * Players come back sorted by id so downstream matrices have a stable row order.
     * Records without a player id are skipped and counted, never fatal for the batch.
     */
    public AggregationResult aggregate(List<RawRecord> records) {
        Map<String, Totals> map = new TreeMap<>();
        int skipped = 0;

        for (RawRecord r : records) {
            String key;
            try {
                key = keyOf(r);
            } catch (MissingIdentifierException ex) {
                skipped++;
                log.warn("Skipping record: {}", ex.getMessage());
                continue;
            }
            map.computeIfAbsent(key, Totals::new).apply(r);
        }

        Map<String, PlayerAggregate> players = new LinkedHashMap<>();
        int zeroExposure = 0;
        for (Totals t : map.values()) {
            PlayerAggregate agg = t.freeze();
            if (agg.zeroExposure()) zeroExposure++;
            players.put(agg.playerId(), agg);
        }

        if (zeroExposure > 0) {
            log.warn("{} players have zero minutes; their rate features will be 0", zeroExposure);
        }
        log.info("Aggregated {} records -> {} players ({} skipped)", records.size(), players.size(), skipped);
        return new AggregationResult(players, records.size(), skipped);
    }

    /**
     * Drops players with fewer than {@code minGames} games or {@code minutes <= minMinutes}
     * (a floor of 0 keeps zero-minute players).
     */
    public List<PlayerAggregate> filter(Collection<PlayerAggregate> players, int minGames, double minMinutes) {
        List<PlayerAggregate> out = new ArrayList<>();
        for (PlayerAggregate p : players) {
            if (p.gamesPlayed() < minGames) continue;
            if (minMinutes > 0 && p.totalMinutes() <= minMinutes) continue;
            out.add(p);
        }
        log.info("Filtered players: {} -> {} (min {} games, min {} minutes)",
                players.size(), out.size(), minGames, minMinutes);
        return out;
    }

    static String keyOf(RawRecord r) {
        if (!r.hasIdentifier()) {
            throw new MissingIdentifierException("record for game " + r.gameId()
                    + " (" + r.playerName() + ") has no player id");
        }
        return r.playerId().trim();
    }
}
