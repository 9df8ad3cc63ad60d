package org.recommender.scoring;

/**
 * How item relevance is obtained for a customer.
 */
public enum ScoringMode {
    /** Scores were computed offline and are looked up per customer. */
    PRECOMPUTED_SCORES,
    /** Scores are inner products of customer and item embedding vectors. */
    VECTOR_SEARCH
}
