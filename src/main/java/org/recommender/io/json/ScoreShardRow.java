package org.recommender.io.json;

import java.util.Objects;

/**
 * One customer's scores inside a {@link ScoreShard}, aligned with the shard's columns.
 */
public record ScoreShardRow(String customerId, double[] scores) {

    public ScoreShardRow {
        Objects.requireNonNull(customerId, "customerId must not be null");
        Objects.requireNonNull(scores, "scores must not be null");
    }
}
