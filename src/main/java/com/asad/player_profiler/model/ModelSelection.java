package com.asad.player_profiler.model;

import java.util.List;

/**
 * @param scores one entry per candidate K, ascending by K
 */
public record ModelSelection(int selectedK, double selectedScore, long seed, List<CandidateScore> scores) {

    public ModelSelection {
        scores = List.copyOf(scores);
    }
}
