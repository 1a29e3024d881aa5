package com.asad.player_profiler.exception;

import com.asad.player_profiler.model.CountingStat;

import java.util.Set;

/**
 * A player aggregate lacks a stat the features need. Fatal for that player only.
 */
public class InvalidAggregateException extends ProfilingException {

    private final String playerId;
    private final Set<CountingStat> missing;

    public InvalidAggregateException(String playerId, Set<CountingStat> missing) {
        super("Player " + playerId + " is missing required stats " + missing);
        this.playerId = playerId;
        this.missing = Set.copyOf(missing);
    }

    public String getPlayerId() {
        return playerId;
    }

    public Set<CountingStat> getMissing() {
        return missing;
    }
}
