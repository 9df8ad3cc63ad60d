package org.recommender.io;

/**
 * Base type for fatal artifact loading failures. Initialization is not retried;
 * the caller fixes the artifacts and rebuilds.
 */
public abstract class ArtifactException extends RuntimeException {

    private final String artifact;

    protected ArtifactException(String artifact, String message, Throwable cause) {
        super(message, cause);
        this.artifact = artifact;
    }

    /** Base name of the artifact that failed. */
    public String artifact() {
        return artifact;
    }
}
