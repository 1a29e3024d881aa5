package com.asad.player_profiler.service;

import com.asad.player_profiler.config.ProfilerProperties;
import com.asad.player_profiler.exception.PipelineAbortedException;
import com.asad.player_profiler.exception.ProfilingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.*;

/**
 * Runs independent tasks on a fixed pool and joins the results into a table ordered by key.
 * Tasks must not share mutable state; completion order does not matter.
 */
@Slf4j
@Component
public class TaskFanOut {

    private final int threads;

    public TaskFanOut(ProfilerProperties properties) {
        this.threads = properties.getParallelism().getThreads();
    }

    public <K extends Comparable<K>, V> SortedMap<K, V> run(String what, Map<K, Callable<V>> tasks) {
        SortedMap<K, V> out = new TreeMap<>();
        if (tasks.isEmpty()) return out;

        int poolSize = Math.max(1, Math.min(threads, tasks.size()));
        ExecutorService pool = Executors.newFixedThreadPool(poolSize);
        CompletionService<Map.Entry<K, V>> cs = new ExecutorCompletionService<>(pool);

        try {
            for (Map.Entry<K, Callable<V>> task : tasks.entrySet()) {
                K key = task.getKey();
                Callable<V> body = task.getValue();
                cs.submit(() -> Map.entry(key, body.call()));
            }

            for (int i = 0; i < tasks.size(); i++) {
                Future<Map.Entry<K, V>> f = cs.take();
                Map.Entry<K, V> e = f.get();
                out.put(e.getKey(), e.getValue());
            }
            log.debug("{}: {} tasks on {} threads", what, tasks.size(), poolSize);
            return out;

        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new PipelineAbortedException(what + " interrupted");
        } catch (ExecutionException ee) {
            Throwable cause = ee.getCause();
            if (cause instanceof ProfilingException pe) throw pe;
            throw new ProfilingException(what + " failed: " + cause.getMessage(), cause);
        } finally {
            pool.shutdownNow();
        }
    }
}
