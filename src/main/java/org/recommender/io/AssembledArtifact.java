package org.recommender.io;

import java.util.List;
import java.util.Objects;

/**
 * Rows of a logical artifact reassembled from its shards, in shard-number order.
 *
 * @param baseName artifact base name
 * @param rows concatenated rows
 * @param loadedShards shard numbers that were read, ascending
 * @param missingShards shard numbers that were absent and tolerated, ascending
 */
public record AssembledArtifact<R>(String baseName, List<R> rows, List<Integer> loadedShards, List<Integer> missingShards) {

    public AssembledArtifact {
        Objects.requireNonNull(baseName, "baseName must not be null");
        rows = List.copyOf(Objects.requireNonNull(rows, "rows must not be null"));
        loadedShards = List.copyOf(Objects.requireNonNull(loadedShards, "loadedShards must not be null"));
        missingShards = List.copyOf(Objects.requireNonNull(missingShards, "missingShards must not be null"));
    }

    public int rowCount() {
        return rows.size();
    }

    public boolean isComplete() {
        return missingShards.isEmpty();
    }
}
