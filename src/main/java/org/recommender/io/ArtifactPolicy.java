package org.recommender.io;

/**
 * Describes how one logical artifact is partitioned on storage.
 * Example: baseName "predicted_ratings", maxShards 6, STRICT
 * covers predicted_ratings_part1 .. predicted_ratings_part6.
 */
public record ArtifactPolicy(String baseName, int maxShards, MissingPolicy missingPolicy) {

    public ArtifactPolicy {
        if (baseName == null || baseName.isBlank()) {
            throw new IllegalArgumentException("baseName must be non-empty");
        }
        if (maxShards < 1) {
            throw new IllegalArgumentException("maxShards must be >= 1, got " + maxShards);
        }
        if (missingPolicy == null) {
            throw new IllegalArgumentException("missingPolicy must not be null");
        }
        baseName = baseName.strip();
    }

    public static ArtifactPolicy strict(String baseName, int maxShards) {
        return new ArtifactPolicy(baseName, maxShards, MissingPolicy.STRICT);
    }

    public static ArtifactPolicy tolerant(String baseName, int maxShards) {
        return new ArtifactPolicy(baseName, maxShards, MissingPolicy.TOLERANT);
    }
}
