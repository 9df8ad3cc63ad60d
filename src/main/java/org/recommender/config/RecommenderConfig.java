package org.recommender.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.recommender.filter.OverfetchPolicy;
import org.recommender.io.ArtifactPolicy;
import org.recommender.io.json.PurchaseFormat;
import org.recommender.io.json.ScoreFormat;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

/**
 * Startup configuration: where the artifacts live, how they are sharded,
 * their field layout, and the query-time overfetch policy.
 *
 * Defaults come from the classpath resource {@value #DEFAULTS_RESOURCE};
 * a user file only needs the keys it changes.
 */
public record RecommenderConfig(String artifactDirectory,
                                ArtifactPolicy ratings,
                                ArtifactPolicy customerVectors,
                                ArtifactPolicy customerIds,
                                ArtifactPolicy itemVectors,
                                ArtifactPolicy itemIds,
                                ArtifactPolicy history,
                                ScoreFormat scoreFormat,
                                PurchaseFormat historyFormat,
                                OverfetchPolicy overfetch,
                                int scoringThreads) {

    public static final String DEFAULTS_RESOURCE = "recommender-defaults.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public RecommenderConfig {
        if (artifactDirectory == null || artifactDirectory.isBlank()) {
            throw new IllegalArgumentException("artifactDirectory must be non-empty");
        }
        Objects.requireNonNull(ratings, "ratings must not be null");
        Objects.requireNonNull(customerVectors, "customerVectors must not be null");
        Objects.requireNonNull(customerIds, "customerIds must not be null");
        Objects.requireNonNull(itemVectors, "itemVectors must not be null");
        Objects.requireNonNull(itemIds, "itemIds must not be null");
        Objects.requireNonNull(history, "history must not be null");
        Objects.requireNonNull(scoreFormat, "scoreFormat must not be null");
        Objects.requireNonNull(historyFormat, "historyFormat must not be null");
        Objects.requireNonNull(overfetch, "overfetch must not be null");
        if (scoringThreads < 1) {
            throw new IllegalArgumentException("scoringThreads must be >= 1, got " + scoringThreads);
        }
    }

    public Path artifactPath() {
        return Path.of(artifactDirectory);
    }

    /**
     * @throws IllegalStateException if the defaults resource is missing from the classpath
     */
    public static RecommenderConfig defaults() {
        return bind(defaultsTree());
    }

    /**
     * Reads a JSON config file and overlays it on the defaults.
     */
    public static RecommenderConfig load(Path file) throws IOException {
        Objects.requireNonNull(file, "file must not be null");
        try (InputStream in = Files.newInputStream(file)) {
            return fromJson(in);
        }
    }

    /**
     * Reads JSON config from a stream and overlays it on the defaults.
     *
     * @throws IllegalArgumentException if a value is invalid or a key is unknown
     */
    public static RecommenderConfig fromJson(InputStream in) throws IOException {
        Objects.requireNonNull(in, "in must not be null");
        JsonNode overrides = MAPPER.readTree(in);
        if (overrides == null || overrides.isMissingNode()) {
            return defaults();
        }
        if (!overrides.isObject()) {
            throw new IllegalArgumentException("Config must be a JSON object");
        }
        ObjectNode merged = defaultsTree();
        overlay(merged, (ObjectNode) overrides);
        return bind(merged);
    }

    private static ObjectNode defaultsTree() {
        InputStream in = RecommenderConfig.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE);
        if (in == null) {
            throw new IllegalStateException("Missing config resource: " + DEFAULTS_RESOURCE);
        }
        try (InputStream stream = in) {
            return (ObjectNode) MAPPER.readTree(stream);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + DEFAULTS_RESOURCE, e);
        }
    }

    private static void overlay(ObjectNode target, ObjectNode source) {
        Iterator<Map.Entry<String, JsonNode>> fields = source.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode existing = target.get(field.getKey());
            if (existing instanceof ObjectNode existingObject && field.getValue() instanceof ObjectNode sourceObject) {
                overlay(existingObject, sourceObject);
            } else {
                target.set(field.getKey(), field.getValue());
            }
        }
    }

    private static RecommenderConfig bind(JsonNode tree) {
        try {
            return MAPPER.treeToValue(tree, RecommenderConfig.class);
        } catch (IOException e) {
            Throwable root = e.getCause() instanceof IllegalArgumentException iae ? iae : e;
            throw new IllegalArgumentException("Invalid recommender config: " + root.getMessage(), e);
        }
    }
}
