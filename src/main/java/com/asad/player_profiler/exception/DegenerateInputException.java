package com.asad.player_profiler.exception;

/**
 * The population cannot be clustered at all (too few players, too few informative columns).
 * Aborts the whole run.
 */
public class DegenerateInputException extends ProfilingException {
    public DegenerateInputException(String message) {
        super(message);
    }
}
