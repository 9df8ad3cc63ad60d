package org.recommender.io;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.zip.GZIPInputStream;

/**
 * Shards stored as files in one directory:
 * {@code <baseName>_part<i>.json.gz} (gzip-compressed) or {@code <baseName>_part<i>.json}.
 * When both exist the compressed file is used.
 */
public final class FileShardStore implements ShardStore {

    static final String GZIP_SUFFIX = ".json.gz";
    static final String PLAIN_SUFFIX = ".json";

    private final Path directory;

    public FileShardStore(Path directory) {
        Objects.requireNonNull(directory, "directory must not be null");
        this.directory = directory.toAbsolutePath().normalize();
    }

    /** File name stem of a shard, without suffix. */
    public static String shardStem(String baseName, int shardNumber) {
        return baseName + "_part" + shardNumber;
    }

    @Override
    public Optional<ShardHandle> locate(String baseName, int shardNumber) {
        Objects.requireNonNull(baseName, "baseName must not be null");
        if (shardNumber < 1) {
            throw new IllegalArgumentException("shardNumber must be >= 1, got " + shardNumber);
        }

        String stem = shardStem(baseName, shardNumber);
        Path gz = directory.resolve(stem + GZIP_SUFFIX);
        if (Files.isRegularFile(gz)) {
            return Optional.of(new FileShard(gz, true));
        }
        Path plain = directory.resolve(stem + PLAIN_SUFFIX);
        if (Files.isRegularFile(plain)) {
            return Optional.of(new FileShard(plain, false));
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "FileShardStore(" + directory + ")";
    }

    private record FileShard(Path path, boolean gzip) implements ShardHandle {

        @Override
        public String name() {
            return path.getFileName().toString();
        }

        @Override
        public InputStream open() throws IOException {
            InputStream in = new BufferedInputStream(Files.newInputStream(path));
            if (!gzip) {
                return in;
            }
            try {
                return new GZIPInputStream(in);
            } catch (IOException e) {
                in.close();
                throw e;
            }
        }
    }
}
