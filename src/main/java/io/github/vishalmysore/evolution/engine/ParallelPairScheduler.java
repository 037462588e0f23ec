package io.github.vishalmysore.evolution.engine;

import io.github.vishalmysore.evolution.domain.EvolutionLink;
import io.github.vishalmysore.evolution.scoring.PairScorer;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.logging.Logger;

/**
 * Scores planned chunks on a bounded worker pool.
 *
 * Each worker pulls the next chunk index from a shared counter until the
 * chunks run out, the run is cancelled or the deadline passes. Results are
 * stored per chunk index and concatenated in chunk order, so the output does
 * not depend on the pool size or on which worker ran which chunk. A chunk that
 * throws (including a stack overflow or linkage error raised by a scorer) is
 * logged and its pairs are counted as skipped; other chunks carry on.
 */
public class ParallelPairScheduler {
    private static final Logger log = Logger.getLogger(ParallelPairScheduler.class.getName());
    private static final long SHUTDOWN_TIMEOUT_MS = 5_000L;

    private final int workerCount;
    private final long timeoutMs;

    public ParallelPairScheduler(int workerCount, long timeoutMs) {
        this.workerCount = Math.max(1, workerCount);
        this.timeoutMs = timeoutMs;
    }

    @Value
    public static class Outcome {
        List<EvolutionLink> links;
        long pairsScored;
        long pairsSkipped;
        long pairsNotDispatched;
        int chunksFailed;
        boolean cancelled;
        boolean timedOut;
    }

    @Value
    private static class ChunkResult {
        List<EvolutionLink> links;
        boolean failed;
    }

    public Outcome run(PairEnumerator enumerator, List<PairChunk> chunks, PairScorer scorer,
            LinkMaterializer materializer, RunControl control) {
        if (chunks.isEmpty())
            return new Outcome(List.of(), 0, 0, 0, 0, control.isCancelled(), false);

        int threads = Math.min(workerCount, chunks.size());
        AtomicReferenceArray<ChunkResult> results = new AtomicReferenceArray<>(chunks.size());
        AtomicInteger nextChunk = new AtomicInteger();
        AtomicBoolean timedOut = new AtomicBoolean();
        long deadline = timeoutMs > 0 ? System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs) : Long.MAX_VALUE;

        ExecutorService pool = createPool(threads);
        List<Future<?>> workers = new ArrayList<>(threads);
        try {
            for (int w = 0; w < threads; w++) {
                workers.add(pool.submit(() -> {
                    while (!control.isCancelled()) {
                        if (nextChunk.get() >= chunks.size())
                            return;
                        if (System.nanoTime() > deadline) {
                            timedOut.set(true);
                            return;
                        }
                        int idx = nextChunk.getAndIncrement();
                        if (idx >= chunks.size())
                            return;
                        results.set(idx, runChunk(enumerator, chunks.get(idx), scorer, materializer));
                    }
                }));
            }
            for (Future<?> worker : workers) {
                worker.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warning("Interrupted while waiting for scoring workers; cancelling run");
            control.cancel();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Scoring worker died", e.getCause());
        } finally {
            shutdown(pool);
        }

        List<EvolutionLink> links = new ArrayList<>();
        long scored = 0;
        long skipped = 0;
        long notDispatched = 0;
        int failed = 0;
        for (int i = 0; i < chunks.size(); i++) {
            ChunkResult result = results.get(i);
            long pairs = chunks.get(i).getPairCount();
            if (result == null) {
                notDispatched += pairs;
            } else if (result.isFailed()) {
                skipped += pairs;
                failed++;
            } else {
                scored += pairs;
                links.addAll(result.getLinks());
            }
        }

        // A worker may see the deadline after another one took the last chunk.
        boolean expired = timedOut.get() && notDispatched > 0;
        if (expired)
            log.warning("Global timeout of " + timeoutMs + " ms reached; " + notDispatched + " pairs not dispatched");
        return new Outcome(links, scored, skipped, notDispatched, failed, control.isCancelled(), expired);
    }

    private ChunkResult runChunk(PairEnumerator enumerator, PairChunk chunk, PairScorer scorer,
            LinkMaterializer materializer) {
        List<EvolutionLink> links = new ArrayList<>();
        try {
            enumerator.forEachPair(chunk, (from, to) -> materializer.materialize(scorer.score(from, to))
                    .ifPresent(links::add));
            return new ChunkResult(links, false);
        } catch (RuntimeException | StackOverflowError | AssertionError | LinkageError e) {
            log.severe("Chunk " + chunk.getIndex() + " (anchors " + chunk.getAnchorStart() + ".."
                    + chunk.getAnchorEnd() + ", " + chunk.getPairCount() + " pairs) failed: " + e);
            return new ChunkResult(List.of(), true);
        }
    }

    private static ExecutorService createPool(int threads) {
        AtomicLong tid = new AtomicLong(1);
        ThreadFactory tf = r -> {
            Thread t = new Thread(r, "evolution-worker-" + tid.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
        return new ThreadPoolExecutor(threads, threads, 30L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(), tf);
    }

    private static void shutdown(ExecutorService pool) {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
        }
    }

    public int getWorkerCount() {
        return workerCount;
    }
}
