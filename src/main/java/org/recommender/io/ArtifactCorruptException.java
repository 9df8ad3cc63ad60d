package org.recommender.io;

/**
 * A shard is present but cannot be decoded, or decoded artifacts disagree with each other.
 */
public final class ArtifactCorruptException extends ArtifactException {

    public ArtifactCorruptException(String artifact, String message, Throwable cause) {
        super(artifact, message, cause);
    }

    public ArtifactCorruptException(String artifact, String message) {
        this(artifact, message, null);
    }
}
