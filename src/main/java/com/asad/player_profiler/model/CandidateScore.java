package com.asad.player_profiler.model;

/** Validity of one candidate cluster count. */
public record CandidateScore(int k, double silhouette, double inertia, boolean converged) {}
