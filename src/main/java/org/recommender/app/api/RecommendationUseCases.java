package org.recommender.app.api;

import org.recommender.app.api.dto.RecommendationResult;
import org.recommender.scoring.ScoringMode;

import java.util.List;

/**
 * Application boundary consumed by presentation layers.
 * Identifiers may be passed as strings or numbers; they are canonicalized before lookup.
 * Returned item ids are canonical strings, joinable against product metadata by equality.
 */
public interface RecommendationUseCases {

    int DEFAULT_COUNT = 10;

    /**
     * Distinct purchased items in first-seen order; empty if the customer bought nothing.
     */
    List<String> getHistory(Object customerId);

    /**
     * Up to n unpurchased items in ranking order, or UNKNOWN_CUSTOMER for a cold start.
     *
     * @throws IllegalArgumentException if the identifier is malformed or n < 1
     */
    RecommendationResult getRecommendations(Object customerId, int n);

    default RecommendationResult getRecommendations(Object customerId) {
        return getRecommendations(customerId, DEFAULT_COUNT);
    }

    /** Customers that can receive recommendations. */
    List<String> customers();

    ScoringMode mode();
}
