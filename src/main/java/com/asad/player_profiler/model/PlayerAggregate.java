package com.asad.player_profiler.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Season totals for one player. Built once by the aggregator, read-only afterwards.
 * A stat listed in {@code missing} was absent from at least one of the player's records,
 * so its total is not trusted.
 */
public record PlayerAggregate(
        String playerId,
        String playerName,
        int gamesPlayed,
        double totalMinutes,
        Map<CountingStat, Integer> totals,
        Set<CountingStat> missing
) {

    public PlayerAggregate {
        if (gamesPlayed < 1) {
            throw new IllegalArgumentException("gamesPlayed must be >= 1 for " + playerId);
        }
        if (totalMinutes < 0) {
            throw new IllegalArgumentException("totalMinutes must be >= 0 for " + playerId);
        }
        totals = Collections.unmodifiableMap(totals.isEmpty()
                ? new EnumMap<>(CountingStat.class)
                : new EnumMap<>(totals));
        missing = Collections.unmodifiableSet(missing.isEmpty()
                ? EnumSet.noneOf(CountingStat.class)
                : EnumSet.copyOf(missing));
    }

    public int total(CountingStat stat) {
        Integer v = totals.get(stat);
        return v == null ? 0 : v;
    }

    public boolean has(CountingStat stat) {
        return totals.containsKey(stat) && !missing.contains(stat);
    }

    /** No minutes at all: rate features cannot be computed for this player. */
    public boolean zeroExposure() {
        return totalMinutes <= 0.0;
    }
}
