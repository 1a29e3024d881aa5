package com.asad.player_profiler.model;

import lombok.Builder;

/**
 * One stat line of one player in one game.
 * Counting stats are nullable: null means the source did not report the stat.
 * Minutes are decimal minutes (the CSV loader converts "MM:SS").
 */
@Builder
public record RawRecord(
        String playerId,
        String playerName,
        String gameId,
        Double minutes,
        Integer points,
        Integer assists,
        Integer offensiveRebounds,
        Integer defensiveRebounds,
        Integer steals,
        Integer blocks,
        Integer turnovers,
        Integer personalFouls,
        Integer fieldGoalsMade,
        Integer fieldGoalsAttempted,
        Integer threePointersMade,
        Integer threePointersAttempted,
        Integer freeThrowsMade,
        Integer freeThrowsAttempted,
        // shot-zone counts, optional
        Integer interiorMade,
        Integer interiorAttempted,
        Integer exteriorMade,
        Integer exteriorAttempted
) {

    public boolean hasIdentifier() {
        return playerId != null && !playerId.isBlank();
    }
}
