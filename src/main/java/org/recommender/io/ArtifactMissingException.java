package org.recommender.io;

/**
 * A required shard (or a required artifact as a whole) is absent.
 */
public final class ArtifactMissingException extends ArtifactException {

    private final int shardNumber;

    public ArtifactMissingException(String artifact, int shardNumber, String message) {
        super(artifact, message, null);
        this.shardNumber = shardNumber;
    }

    /** 1-based number of the absent shard, or 0 when no shard of the artifact exists at all. */
    public int shardNumber() {
        return shardNumber;
    }
}
