package org.recommender.scoring;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.recommender.index.IdentityIndex;
import org.recommender.model.EmbeddingTable;
import org.recommender.model.Vector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;

/**
 * Exact inner-product search: scores a customer's vector against every item vector.
 *
 * The item rows are split into contiguous partitions scanned on a worker pool;
 * each partition keeps its own top list and the partial lists are merged with
 * {@link CandidateOrder}. With a single partition (or no executor) the scan runs
 * on the calling thread.
 */
public final class VectorSearchEngine implements ScoringEngine {

    private static final Logger log = LoggerFactory.getLogger(VectorSearchEngine.class);

    private final EmbeddingTable customers;
    private final EmbeddingTable items;
    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final int partitions;

    /**
     * Single-threaded engine.
     */
    public VectorSearchEngine(EmbeddingTable customers, EmbeddingTable items) {
        this(customers, items, null, 1, false);
    }

    /**
     * Engine scanning on a caller-supplied executor. The executor is not shut down by {@link #close()}.
     *
     * @param partitions number of item slices scored in parallel (>= 1)
     */
    public VectorSearchEngine(EmbeddingTable customers, EmbeddingTable items, ExecutorService executor, int partitions) {
        this(customers, items, Objects.requireNonNull(executor, "executor must not be null"), partitions, false);
    }

    private VectorSearchEngine(EmbeddingTable customers,
                               EmbeddingTable items,
                               ExecutorService executor,
                               int partitions,
                               boolean ownsExecutor) {
        this.customers = Objects.requireNonNull(customers, "customers must not be null");
        this.items = Objects.requireNonNull(items, "items must not be null");
        if (partitions < 1) throw new IllegalArgumentException("partitions must be >= 1");
        this.executor = executor;
        this.partitions = partitions;
        this.ownsExecutor = ownsExecutor;
    }

    /**
     * Engine with its own fixed pool of {@code threads} workers (one partition per worker).
     * {@code threads <= 1} gives a single-threaded engine.
     */
    public static VectorSearchEngine withThreads(EmbeddingTable customers, EmbeddingTable items, int threads) {
        if (threads <= 1) {
            return new VectorSearchEngine(customers, items);
        }
        ExecutorService pool = Executors.newFixedThreadPool(threads, workerThreadFactory());
        log.info("Vector search using {} worker threads over {} items", threads, items.size());
        return new VectorSearchEngine(customers, items, pool, threads, true);
    }

    @Override
    public ScoringMode mode() {
        return ScoringMode.VECTOR_SEARCH;
    }

    @Override
    public boolean knowsCustomer(Object customerId) {
        return customers.index().contains(customerId);
    }

    @Override
    public List<String> customers() {
        return customers.index().distinctIds();
    }

    @Override
    public int catalogSize() {
        return items.index().distinctSize();
    }

    @Override
    public Optional<List<RankedCandidate>> rank(Object customerId, int limit) {
        if (limit <= 0) throw new IllegalArgumentException("limit must be >= 1");

        OptionalInt row = customers.index().indexOf(customerId);
        if (row.isEmpty()) {
            return Optional.empty();
        }
        if (customers.dimension() != items.dimension()) {
            throw new DimensionMismatchException(customers.dimension(), items.dimension());
        }

        Vector query = customers.vectorAt(row.getAsInt());
        int slices = Math.min(partitions, items.size());

        if (executor == null || slices <= 1) {
            return Optional.of(scanRange(query, 0, items.size(), limit));
        }
        return Optional.of(parallelScan(query, slices, limit));
    }

    private List<RankedCandidate> parallelScan(Vector query, int slices, int limit) {
        int total = items.size();
        List<Future<List<RankedCandidate>>> futures = new ArrayList<>(slices);
        for (int i = 0; i < slices; i++) {
            int from = (int) ((long) total * i / slices);
            int to = (int) ((long) total * (i + 1) / slices);
            Callable<List<RankedCandidate>> task = () -> scanRange(query, from, to, limit);
            futures.add(executor.submit(task));
        }

        List<List<RankedCandidate>> partials = new ArrayList<>(slices);
        for (Future<List<RankedCandidate>> future : futures) {
            try {
                partials.add(future.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                throw new IllegalStateException("Interrupted while scoring items", e);
            } catch (ExecutionException e) {
                futures.forEach(f -> f.cancel(true));
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException re) {
                    throw re;
                }
                throw new IllegalStateException("Item scoring failed", cause);
            }
        }
        return TopCandidates.merge(partials, limit);
    }

    private List<RankedCandidate> scanRange(Vector query, int from, int to, int limit) {
        IdentityIndex index = items.index();
        TopCandidates top = new TopCandidates(limit);
        for (int row = from; row < to; row++) {
            if (!index.isLive(row)) {
                continue;
            }
            double score = query.dot(items.vectorAt(row));
            top.offer(new RankedCandidate(index.idAt(row), score, row));
        }
        return top.toRankedList();
    }

    @Override
    public void close() {
        if (ownsExecutor && executor != null) {
            executor.shutdownNow();
        }
    }

    static ThreadFactory workerThreadFactory() {
        return new ThreadFactoryBuilder().setDaemon(true).setNameFormat("vector-search-%d").build();
    }
}
