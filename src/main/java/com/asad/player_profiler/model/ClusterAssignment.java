package com.asad.player_profiler.model;

public record ClusterAssignment(String playerId, int label, double distance) {}
