package com.asad.player_profiler.exception;

/**
 * A raw record cannot be attributed to a player. Fatal for the record only.
 */
public class MissingIdentifierException extends ProfilingException {
    public MissingIdentifierException(String message) {
        super(message);
    }
}
