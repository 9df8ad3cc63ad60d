package org.recommender.scoring;

import java.util.List;
import java.util.Optional;

/**
 * Ranks the catalog for one customer.
 *
 * Implementations are immutable after construction and safe for concurrent readers.
 */
public interface ScoringEngine extends AutoCloseable {

    ScoringMode mode();

    /**
     * @return true if the customer can be scored
     * @throws IllegalArgumentException if the identifier is malformed
     */
    boolean knowsCustomer(Object customerId);

    /** Customers that can be scored, in table order. */
    List<String> customers();

    /** Number of distinct items that can be ranked. */
    int catalogSize();

    /**
     * Returns the best {@code limit} catalog items for the customer in ranking order
     * (see {@link CandidateOrder}).
     *
     * @return empty if the customer is unknown (cold start)
     * @throws IllegalArgumentException if the identifier is malformed or limit < 1
     * @throws DimensionMismatchException if customer and item vectors disagree in dimension
     */
    Optional<List<RankedCandidate>> rank(Object customerId, int limit);

    /** Releases worker threads, if any. */
    @Override
    default void close() {
    }
}
