package org.recommender.app.api.dto;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a recommendation query.
 * {@link Status#UNKNOWN_CUSTOMER} (cold start) always carries an empty item list;
 * {@link Status#FOUND} may also be empty when nothing eligible is left.
 */
public record RecommendationResult(Status status, List<String> items) {

    public enum Status {
        FOUND,
        UNKNOWN_CUSTOMER
    }

    private static final RecommendationResult UNKNOWN = new RecommendationResult(Status.UNKNOWN_CUSTOMER, List.of());

    public RecommendationResult {
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(items, "items must not be null");
        items = List.copyOf(items);
        if (status == Status.UNKNOWN_CUSTOMER && !items.isEmpty()) {
            throw new IllegalArgumentException("UNKNOWN_CUSTOMER result must not carry items");
        }
    }

    public static RecommendationResult found(List<String> items) {
        return new RecommendationResult(Status.FOUND, items);
    }

    public static RecommendationResult unknownCustomer() {
        return UNKNOWN;
    }

    public boolean isUnknownCustomer() {
        return status == Status.UNKNOWN_CUSTOMER;
    }
}
