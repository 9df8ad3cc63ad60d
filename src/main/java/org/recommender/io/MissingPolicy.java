package org.recommender.io;

/**
 * What the assembler does when a shard in 1..maxShards is absent.
 */
public enum MissingPolicy {
    /** A missing shard aborts assembly with {@link ArtifactMissingException}. */
    STRICT,
    /** A missing shard is logged and skipped. */
    TOLERANT
}
