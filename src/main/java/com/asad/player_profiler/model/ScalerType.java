package com.asad.player_profiler.model;

public enum ScalerType {
    /** (x - mean) / std */
    STANDARD,
    /** (x - min) / (max - min) */
    MIN_MAX
}
