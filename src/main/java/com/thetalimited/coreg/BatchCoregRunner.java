package com.thetalimited.coreg;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.thetalimited.coreg.io.RasterSource;

/**
 * Runs many independent reference/target pairs on a fixed pool of worker
 * threads. Every pair gets its own {@link Coreg} instance; nothing mutable is
 * shared between pairs.
 */
public class BatchCoregRunner implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(BatchCoregRunner.class);

    private final ExecutorService pool;

    public BatchCoregRunner(int threads)
    {
        if (threads < 1) throw new IllegalArgumentException("need at least one worker thread, got " + threads);
        this.pool = Executors.newFixedThreadPool(threads);
    }

    public static final class Pair
    {
        private final String id;
        private final RasterSource reference, target;
        private final CoregConfig config;

        public Pair(String id, RasterSource reference, RasterSource target, CoregConfig config)
        {
            this.id = id;
            this.reference = reference;
            this.target = target;
            this.config = config;
        }

        public String getId() { return id; }
        public RasterSource getReference() { return reference; }
        public RasterSource getTarget() { return target; }
        public CoregConfig getConfig() { return config; }
    }

    /**
     * Detect the shift of every pair and, where the pair's config names a
     * {@code pathOut}, write the corrected target too.
     *
     * @return one result per pair id, in submission order; failed pairs give failed results
     * @throws UncheckedIOException if an input cannot be read or an output cannot be written
     */
    public Map<String, ShiftResult> run(List<Pair> pairs)
    {
        List<Future<ShiftResult>> futures = new ArrayList<>(pairs.size());
        for (Pair p : pairs) {
            futures.add(pool.submit(() -> runOne(p)));
        }

        Map<String, ShiftResult> results = new LinkedHashMap<>();
        for (int i = 0; i < pairs.size(); i++) {
            try {
                results.put(pairs.get(i).getId(), futures.get(i).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("interrupted while waiting for pair " + pairs.get(i).getId(), e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException) throw (RuntimeException) cause;
                throw new IllegalStateException("pair " + pairs.get(i).getId() + " failed", cause);
            }
        }
        return results;
    }

    static ShiftResult runOne(Pair p)
    {
        log.info("pair {}: {} -> {}", p.getId(), p.getTarget(), p.getReference());
        try {
            Coreg cr = new Coreg(p.getReference(), p.getTarget(), p.getConfig());
            ShiftResult result = cr.calculateSpatialShifts();
            if (result.isSuccess() && p.getConfig().getPathOut() != null) {
                cr.correctShifts();
            }
            return result;
        } catch (CoregException e) {
            log.warn("pair {} failed: {}", p.getId(), e.getMessage());
            return ShiftResult.failure(e, new ArrayList<>());
        } catch (IOException e) {
            throw new UncheckedIOException("pair " + p.getId() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void close()
    {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(1, TimeUnit.MINUTES)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
