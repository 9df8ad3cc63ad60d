package org.recommender.app.service;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.recommender.app.api.dto.RecommendationResult;
import org.recommender.config.RecommenderConfig;
import org.recommender.io.ArtifactCorruptException;
import org.recommender.io.ArtifactMissingException;
import org.recommender.io.InMemoryShardStore;
import org.recommender.scoring.DimensionMismatchException;
import org.recommender.scoring.ScoringMode;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.zip.GZIPOutputStream;

import static org.junit.jupiter.api.Assertions.*;

public class SnapshotLoaderTest {

    private static RecommenderConfig config(String json) {
        try {
            return RecommenderConfig.fromJson(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
        } catch (IOException e) {
            throw new AssertionError(e);
        }
    }

    /** Two ratings shards and two history shards, everything else defaulted. */
    private static RecommenderConfig twoShardConfig() {
        return config("{\"ratings\": {\"maxShards\": 2}, \"history\": {\"maxShards\": 2}}");
    }

    private static final String RATINGS_1 = """
            {"columns": ["A1", "A2", "A3", "A4", "A5"],
             "rows": [{"customer_id": 1024, "scores": [0.8, 0.9, 0.7, 0.6, 0.5]}]}
            """;

    private static final String RATINGS_2 = """
            {"columns": ["A1", "A2", "A3", "A4", "A5"],
             "rows": [{"customer_id": "2048", "scores": [0.5, 0.4, 0.3, 0.2, null]}]}
            """;

    private static final String HISTORY_1 = """
            [{"customer_id": 1024, "mid": "A1"}, {"customer_id": "1024", "mid": "A2"}]
            """;

    private static InMemoryShardStore precomputedStore() {
        return new InMemoryShardStore()
                .put("predicted_ratings", 1, RATINGS_1)
                .put("predicted_ratings", 2, RATINGS_2)
                .put("user_history", 1, HISTORY_1);
    }

    private static InMemoryShardStore vectorStore() {
        return new InMemoryShardStore()
                .put("customer_vectors", 1, "[[1.0, 0.0], [0.0, 1.0]]")
                .put("customer_ids", 1, "[\"u1\", 2]")
                .put("item_vectors", 1, "[[3, 1], [2, 2], [1, 3]]")
                .put("item_ids", 1, "[\"x\", \"y\", \"z\"]")
                .put("user_history", 1, "[{\"customer_id\": \"u1\", \"mid\": \"x\"}]");
    }

    // ----------------------------
    // Precomputed mode
    // ----------------------------
    @Nested
    class Precomputed {

        @Test
        void load_assemblesAllShards_andServesQueries() {
            try (RecommenderSnapshot snapshot = new SnapshotLoader(twoShardConfig(), precomputedStore()).load()) {
                RecommendationService service = new RecommendationService(snapshot, twoShardConfig().overfetch());

                assertEquals(ScoringMode.PRECOMPUTED_SCORES, service.mode());
                assertEquals(List.of("1024", "2048"), service.customers());
                assertEquals(List.of("A3", "A4"), service.getRecommendations(1024, 2).items());
                // null score is NaN and ranks last
                assertEquals(List.of("A1", "A2", "A3", "A4", "A5"), service.getRecommendations("2048", 5).items());
                assertEquals(List.of("A1", "A2"), service.getHistory("1024"));
            }
        }

        @Test
        void missingRatingsShard_isFatal() {
            InMemoryShardStore store = new InMemoryShardStore()
                    .put("predicted_ratings", 1, RATINGS_1)
                    .put("user_history", 1, HISTORY_1);

            ArtifactMissingException ex = assertThrows(ArtifactMissingException.class,
                    () -> new SnapshotLoader(twoShardConfig(), store).load());

            assertEquals("predicted_ratings", ex.artifact());
            assertEquals(2, ex.shardNumber());
        }

        @Test
        void missingHistoryShards_areTolerated() {
            InMemoryShardStore store = new InMemoryShardStore()
                    .put("predicted_ratings", 1, RATINGS_1)
                    .put("predicted_ratings", 2, RATINGS_2);

            try (RecommenderSnapshot snapshot = new SnapshotLoader(twoShardConfig(), store).load()) {
                assertEquals(0, snapshot.history().customerCount());
                assertEquals(List.of("A2", "A1"), new RecommendationService(snapshot, twoShardConfig().overfetch())
                        .getRecommendations("1024", 2).items());
            }
        }

        @Test
        void shardsDisagreeingOnColumns_areCorrupt() {
            InMemoryShardStore store = precomputedStore()
                    .put("predicted_ratings", 2, """
                            {"columns": ["A1", "A2", "A3", "A4", "Z9"],
                             "rows": [{"customer_id": "2048", "scores": [0.5, 0.4, 0.3, 0.2, 0.1]}]}
                            """);

            ArtifactCorruptException ex = assertThrows(ArtifactCorruptException.class,
                    () -> new SnapshotLoader(twoShardConfig(), store).load());

            assertEquals("predicted_ratings", ex.artifact());
        }

        @Test
        void shardWithoutRows_mustStillAgreeOnColumns() {
            InMemoryShardStore store = new InMemoryShardStore()
                    .put("predicted_ratings", 1, "{\"columns\": [\"A1\", \"A2\"], \"rows\": []}")
                    .put("predicted_ratings", 2, """
                            {"columns": ["Z8", "Z9"],
                             "rows": [{"customer_id": "2048", "scores": [0.5, 0.4]}]}
                            """);

            ArtifactCorruptException ex = assertThrows(ArtifactCorruptException.class,
                    () -> new SnapshotLoader(twoShardConfig(), store).load());

            assertEquals("predicted_ratings", ex.artifact());
            assertTrue(ex.getMessage().contains("Shard 2"), ex.getMessage());
        }

        @Test
        void emptyShard_withMatchingColumns_isAccepted() {
            InMemoryShardStore store = precomputedStore()
                    .put("predicted_ratings", 1, "{\"columns\": [\"A1\", \"A2\", \"A3\", \"A4\", \"A5\"], \"rows\": []}");

            try (RecommenderSnapshot snapshot = new SnapshotLoader(twoShardConfig(), store).load()) {
                assertEquals(List.of("2048"), snapshot.engine().customers());
                assertEquals(5, snapshot.engine().catalogSize());
            }
        }

        @Test
        void malformedHistoryShard_isCorrupt_evenUnderTolerantPolicy() {
            InMemoryShardStore store = precomputedStore().put("user_history", 2, "{not json");

            ArtifactCorruptException ex = assertThrows(ArtifactCorruptException.class,
                    () -> new SnapshotLoader(twoShardConfig(), store).load());

            assertEquals("user_history", ex.artifact());
        }
    }

    // ----------------------------
    // Vector mode
    // ----------------------------
    @Nested
    class Vectors {

        @Test
        void load_withoutRatings_selectsVectorSearch() {
            SnapshotLoader loader = new SnapshotLoader(twoShardConfig(), vectorStore());
            assertEquals(ScoringMode.VECTOR_SEARCH, loader.detectMode());

            try (RecommenderSnapshot snapshot = loader.load()) {
                RecommendationService service = new RecommendationService(snapshot, twoShardConfig().overfetch());

                assertEquals(List.of("u1", "2"), service.customers());
                assertEquals(List.of("y", "z"), service.getRecommendations("u1", 2).items());
                assertEquals(List.of("z", "y", "x"), service.getRecommendations(2, 3).items());
            }
        }

        @Test
        void ratingsTakePrecedence_whenBothArePresent() {
            InMemoryShardStore store = vectorStore()
                    .put("predicted_ratings", 1, RATINGS_1)
                    .put("predicted_ratings", 2, RATINGS_2);

            assertEquals(ScoringMode.PRECOMPUTED_SCORES, new SnapshotLoader(twoShardConfig(), store).detectMode());
        }

        @Test
        void partialRatings_stillSelectPrecomputed_andFailOnTheGap() {
            InMemoryShardStore store = vectorStore().put("predicted_ratings", 2, RATINGS_2);
            SnapshotLoader loader = new SnapshotLoader(twoShardConfig(), store);

            assertEquals(ScoringMode.PRECOMPUTED_SCORES, loader.detectMode());
            ArtifactMissingException ex = assertThrows(ArtifactMissingException.class, loader::load);
            assertEquals("predicted_ratings", ex.artifact());
            assertEquals(1, ex.shardNumber());
        }

        @Test
        void idAndVectorCountsDiffer_isCorrupt() {
            InMemoryShardStore store = vectorStore().put("item_ids", 1, "[\"x\", \"y\"]");

            ArtifactCorruptException ex = assertThrows(ArtifactCorruptException.class,
                    () -> new SnapshotLoader(twoShardConfig(), store).load());

            assertEquals("item_vectors", ex.artifact());
        }

        @Test
        void dimensionMismatch_loads_butFailsOnQuery() {
            InMemoryShardStore store = vectorStore().put("item_vectors", 1, "[[1, 2, 3], [1, 1, 1], [0, 0, 1]]");

            try (RecommenderSnapshot snapshot = new SnapshotLoader(twoShardConfig(), store).load()) {
                RecommendationService service = new RecommendationService(snapshot, twoShardConfig().overfetch());

                assertThrows(DimensionMismatchException.class, () -> service.getRecommendations("u1", 2));
                assertTrue(service.getRecommendations("nobody", 2).isUnknownCustomer());
            }
        }
    }

    @Test
    void noScoringArtifacts_reportsRatingsMissing() {
        InMemoryShardStore store = new InMemoryShardStore().put("user_history", 1, HISTORY_1);

        ArtifactMissingException ex = assertThrows(ArtifactMissingException.class,
                () -> new SnapshotLoader(twoShardConfig(), store).load());

        assertEquals("predicted_ratings", ex.artifact());
        assertEquals(0, ex.shardNumber());
    }

    // ----------------------------
    // Files on disk
    // ----------------------------
    @Test
    void fromConfig_readsGzipAndPlainShardsFromDirectory(@TempDir Path dir) throws IOException {
        writeGzip(dir.resolve("predicted_ratings_part1.json.gz"), RATINGS_1);
        Files.writeString(dir.resolve("predicted_ratings_part2.json"), RATINGS_2);
        writeGzip(dir.resolve("user_history_part1.json.gz"), HISTORY_1);

        String json = "{\"artifactDirectory\": \"" + dir.toString().replace("\\", "\\\\") + "\","
                + " \"ratings\": {\"maxShards\": 2}, \"history\": {\"maxShards\": 2}}";
        RecommendationService service = RecommendationService.fromConfig(config(json));

        RecommendationResult result = service.getRecommendations("1024", 10);
        assertEquals(RecommendationResult.Status.FOUND, result.status());
        assertEquals(List.of("A3", "A4", "A5"), result.items());
        assertTrue(service.getRecommendations("7", 10).isUnknownCustomer());
    }

    private static void writeGzip(Path file, String content) throws IOException {
        try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(file))) {
            out.write(content.getBytes(StandardCharsets.UTF_8));
        }
    }
}
