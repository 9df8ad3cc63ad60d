package org.recommender.io.json;

import java.util.List;
import java.util.Objects;

/**
 * A decoded precomputed-score shard. The column header is kept even when the shard
 * has no rows, so shards can be checked against each other.
 */
public record ScoreShard(List<String> columns, List<ScoreShardRow> rows) {

    public ScoreShard {
        columns = List.copyOf(Objects.requireNonNull(columns, "columns must not be null"));
        rows = List.copyOf(Objects.requireNonNull(rows, "rows must not be null"));
        for (ScoreShardRow row : rows) {
            if (row.scores().length != columns.size()) {
                throw new IllegalArgumentException("Row for customer '" + row.customerId() + "' has "
                        + row.scores().length + " scores but there are " + columns.size() + " columns");
            }
        }
    }
}
