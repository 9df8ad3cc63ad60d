package org.recommender.app.service;

import org.recommender.model.PurchaseHistory;
import org.recommender.scoring.ScoringEngine;

import java.util.Objects;

/**
 * Everything a request needs, built once and never mutated.
 */
public record RecommenderSnapshot(ScoringEngine engine, PurchaseHistory history) implements AutoCloseable {

    public RecommenderSnapshot {
        Objects.requireNonNull(engine, "engine must not be null");
        Objects.requireNonNull(history, "history must not be null");
    }

    @Override
    public void close() {
        engine.close();
    }
}
