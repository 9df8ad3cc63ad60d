package org.recommender.io;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Decodes one independently-readable shard into its rows, in stored order.
 *
 * Implementations throw {@link IOException} for unreadable input and
 * {@link IllegalArgumentException} for well-formed input with invalid content;
 * the assembler reports both as {@link ArtifactCorruptException}.
 */
@FunctionalInterface
public interface ShardDecoder<R> {

    List<R> decode(InputStream in) throws IOException;
}
