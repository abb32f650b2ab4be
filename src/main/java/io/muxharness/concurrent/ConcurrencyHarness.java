package io.muxharness.concurrent;

import io.muxharness.process.TargetSpawnException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs independent boolean units of work on a fixed-size pool and decides the batch
 * with a {@link QuorumRule}. Every unit is joined before any decision is made; a unit
 * that throws counts as a failed unit, except for a {@link TargetSpawnException}, which is
 * rethrown once the whole batch has been joined.
 */
public final class ConcurrencyHarness {
    private static final Logger log = LoggerFactory.getLogger(ConcurrencyHarness.class);
    private static final AtomicInteger POOL_SEQ = new AtomicInteger();

    private final int poolSize;
    private final QuorumRule quorum;

    public ConcurrencyHarness(int poolSize, QuorumRule quorum) {
        if (poolSize < 1) {
            throw new IllegalArgumentException("worker pool size must be positive: " + poolSize);
        }
        this.poolSize = poolSize;
        this.quorum = quorum;
    }

    public BatchResult runAll(List<? extends Callable<Boolean>> units) {
        List<Boolean> outcomes = collect(units);
        int successes = 0;
        for (Boolean ok : outcomes) {
            if (ok) {
                successes++;
            }
        }
        int required = quorum.required(outcomes.size());
        return new BatchResult(outcomes, required, quorum.accepts(successes, outcomes.size()));
    }

    public QuorumRule quorum() {
        return quorum;
    }

    private List<Boolean> collect(List<? extends Callable<Boolean>> units) {
        if (units == null || units.isEmpty()) {
            return List.of();
        }
        int poolId = POOL_SEQ.incrementAndGet();
        AtomicInteger threadSeq = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(poolSize, units.size()), r -> {
            Thread t = new Thread(r, "muxharness-worker-" + poolId + "-" + threadSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            List<Future<Boolean>> futures = pool.invokeAll(units);
            List<Boolean> outcomes = new ArrayList<>(futures.size());
            TargetSpawnException spawnFailure = null;
            for (Future<Boolean> future : futures) {
                try {
                    outcomes.add(resolve(future));
                } catch (TargetSpawnException e) {
                    if (spawnFailure == null) {
                        spawnFailure = e;
                    }
                    outcomes.add(false);
                }
            }
            if (spawnFailure != null) {
                throw spawnFailure;
            }
            return outcomes;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while waiting for concurrent units", e);
        } finally {
            pool.shutdownNow();
            awaitTermination(pool);
        }
    }

    private static boolean resolve(Future<Boolean> future) throws InterruptedException {
        try {
            return Boolean.TRUE.equals(future.get());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof TargetSpawnException) {
                throw (TargetSpawnException) cause;
            }
            log.warn("concurrent unit failed: {}", cause.toString());
            return false;
        }
    }

    private static void awaitTermination(ExecutorService pool) {
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("worker pool did not terminate within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
