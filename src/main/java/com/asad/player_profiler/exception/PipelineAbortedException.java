package com.asad.player_profiler.exception;

public class PipelineAbortedException extends ProfilingException {
    public PipelineAbortedException(String message) {
        super(message);
    }
}
