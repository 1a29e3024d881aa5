package com.asad.player_profiler.model;

import java.util.function.Function;

/**
 * Stats summed per player by the aggregator.
 * Shot-zone stats are optional: a player without them still gets a feature vector.
 */
public enum CountingStat {

    POINTS("pts", true, RawRecord::points),
    ASSISTS("ast", true, RawRecord::assists),
    OFFENSIVE_REBOUNDS("orb", true, RawRecord::offensiveRebounds),
    DEFENSIVE_REBOUNDS("drb", true, RawRecord::defensiveRebounds),
    STEALS("stl", true, RawRecord::steals),
    BLOCKS("blk", true, RawRecord::blocks),
    TURNOVERS("tov", true, RawRecord::turnovers),
    PERSONAL_FOULS("pf", true, RawRecord::personalFouls),
    FIELD_GOALS_MADE("fgm", true, RawRecord::fieldGoalsMade),
    FIELD_GOALS_ATTEMPTED("fga", true, RawRecord::fieldGoalsAttempted),
    THREE_POINTERS_MADE("3pm", true, RawRecord::threePointersMade),
    THREE_POINTERS_ATTEMPTED("3pa", true, RawRecord::threePointersAttempted),
    FREE_THROWS_MADE("ftm", true, RawRecord::freeThrowsMade),
    FREE_THROWS_ATTEMPTED("fta", true, RawRecord::freeThrowsAttempted),
    INTERIOR_MADE("interior_m", false, RawRecord::interiorMade),
    INTERIOR_ATTEMPTED("interior_a", false, RawRecord::interiorAttempted),
    EXTERIOR_MADE("exterior_m", false, RawRecord::exteriorMade),
    EXTERIOR_ATTEMPTED("exterior_a", false, RawRecord::exteriorAttempted);

    private final String column;
    private final boolean required;
    private final Function<RawRecord, Integer> extractor;

    CountingStat(String column, boolean required, Function<RawRecord, Integer> extractor) {
        this.column = column;
        this.required = required;
        this.extractor = extractor;
    }

    /** CSV header name of this stat. */
    public String column() {
        return column;
    }

    public boolean required() {
        return required;
    }

    public Integer of(RawRecord record) {
        return extractor.apply(record);
    }
}
