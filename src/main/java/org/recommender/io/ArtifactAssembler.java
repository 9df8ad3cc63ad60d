package org.recommender.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Reassembles a logically single table from its ordered shards.
 *
 * Shards 1..maxShards are read in shard-number order and their rows concatenated,
 * each shard keeping its own row order. The result row count is the sum of the
 * loaded shards' row counts.
 *
 * Missing shards follow the artifact's {@link MissingPolicy}. A shard that exists
 * but cannot be decoded always aborts assembly with {@link ArtifactCorruptException};
 * no partial result is returned.
 */
public final class ArtifactAssembler {

    private static final Logger log = LoggerFactory.getLogger(ArtifactAssembler.class);

    private final ShardStore store;

    public ArtifactAssembler(ShardStore store) {
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    public <R> AssembledArtifact<R> assemble(ArtifactPolicy policy, ShardDecoder<R> decoder) {
        Objects.requireNonNull(policy, "policy must not be null");
        Objects.requireNonNull(decoder, "decoder must not be null");

        String base = policy.baseName();
        List<R> rows = new ArrayList<>();
        List<Integer> loaded = new ArrayList<>();
        List<Integer> missing = new ArrayList<>();

        for (int shard = 1; shard <= policy.maxShards(); shard++) {
            Optional<ShardStore.ShardHandle> handle = store.locate(base, shard);

            if (handle.isEmpty()) {
                if (policy.missingPolicy() == MissingPolicy.STRICT) {
                    throw new ArtifactMissingException(base, shard,
                            "Required shard " + shard + "/" + policy.maxShards() + " of '" + base
                                    + "' not found in " + store);
                }
                log.warn("Shard {}/{} of '{}' not found; continuing without it", shard, policy.maxShards(), base);
                missing.add(shard);
                continue;
            }

            List<R> shardRows = decodeShard(base, handle.get(), decoder);
            log.debug("Loaded shard {} of '{}' ({}): {} rows", shard, base, handle.get().name(), shardRows.size());
            rows.addAll(shardRows);
            loaded.add(shard);
        }

        if (loaded.isEmpty()) {
            log.warn("No shards of '{}' were found; using an empty artifact", base);
        }

        AssembledArtifact<R> result = new AssembledArtifact<>(base, rows, loaded, missing);
        log.info("Assembled '{}': {} rows from {} shard(s){}", base, result.rowCount(), result.loadedShards().size(),
                result.isComplete() ? "" : ", missing " + result.missingShards());
        return result;
    }

    private static <R> List<R> decodeShard(String base, ShardStore.ShardHandle handle, ShardDecoder<R> decoder) {
        try (InputStream in = handle.open()) {
            List<R> decoded = decoder.decode(in);
            if (decoded == null) {
                throw new ArtifactCorruptException(base, "Decoder returned no rows for shard " + handle.name());
            }
            return decoded;
        } catch (IOException | UncheckedIOException e) {
            throw new ArtifactCorruptException(base,
                    "Failed to read shard " + handle.name() + " of '" + base + "': " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new ArtifactCorruptException(base,
                    "Invalid content in shard " + handle.name() + " of '" + base + "': " + e.getMessage(), e);
        }
    }
}
