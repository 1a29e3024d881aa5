package com.asad.player_profiler.exception;

public class ProfilingException extends RuntimeException {
    public ProfilingException(String message) {
        super(message);
    }

    public ProfilingException(String message, Throwable cause) {
        super(message, cause);
    }
}
