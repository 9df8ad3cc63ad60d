package org.recommender.io;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

/**
 * Locates the physical shards of an artifact (file system, classpath, object store, ...).
 */
public interface ShardStore {

    /**
     * @param baseName artifact base name
     * @param shardNumber 1-based shard number
     * @return a handle if the shard exists, empty otherwise
     */
    Optional<ShardHandle> locate(String baseName, int shardNumber);

    /**
     * One located shard. {@link #open()} returns a fresh, already-decompressed stream.
     */
    interface ShardHandle {

        /** Human-readable name used in logs and error messages. */
        String name();

        InputStream open() throws IOException;
    }
}
