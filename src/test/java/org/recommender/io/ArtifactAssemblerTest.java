package org.recommender.io;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.recommender.io.json.JsonIdShardDecoder;
import org.recommender.io.json.JsonPurchaseShardDecoder;
import org.recommender.io.json.PurchaseFormat;
import org.recommender.model.PurchaseRecord;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ArtifactAssemblerTest {

    private static final JsonIdShardDecoder IDS = new JsonIdShardDecoder();

    @Nested
    class Ordering {

        @Test
        void assemble_concatenatesInShardNumberOrder_preservingRowOrder() {
            InMemoryShardStore store = new InMemoryShardStore()
                    .put("ids", 3, "[\"e\"]")
                    .put("ids", 1, "[\"b\", \"a\"]")
                    .put("ids", 2, "[\"d\", \"c\"]");

            AssembledArtifact<String> out = new ArtifactAssembler(store)
                    .assemble(ArtifactPolicy.strict("ids", 3), IDS);

            assertEquals(List.of("b", "a", "d", "c", "e"), out.rows());
            assertEquals(List.of(1, 2, 3), out.loadedShards());
            assertTrue(out.isComplete());
        }

        @Test
        void assemble_shardedEqualsUnsharded() {
            InMemoryShardStore sharded = new InMemoryShardStore()
                    .put("ids", 1, "[1, 2]")
                    .put("ids", 2, "[3]")
                    .put("ids", 3, "[4, 5, 6]");
            InMemoryShardStore single = new InMemoryShardStore()
                    .put("ids", 1, "[1, 2, 3, 4, 5, 6]");

            AssembledArtifact<String> a = new ArtifactAssembler(sharded).assemble(ArtifactPolicy.strict("ids", 3), IDS);
            AssembledArtifact<String> b = new ArtifactAssembler(single).assemble(ArtifactPolicy.strict("ids", 1), IDS);

            assertEquals(b.rowCount(), a.rowCount());
            assertEquals(b.rows(), a.rows());
        }

        @Test
        void assemble_rowCountIsSumOfShardRowCounts() {
            InMemoryShardStore store = new InMemoryShardStore()
                    .put("ids", 1, "[1, 2, 2]")
                    .put("ids", 2, "[]")
                    .put("ids", 3, "[2, 9]");

            AssembledArtifact<String> out = new ArtifactAssembler(store).assemble(ArtifactPolicy.strict("ids", 3), IDS);

            // Duplicates across shard boundaries are neither dropped nor merged here.
            assertEquals(5, out.rowCount());
        }

        @Test
        void assemble_returnsImmutableRows() {
            InMemoryShardStore store = new InMemoryShardStore().put("ids", 1, "[1]");
            AssembledArtifact<String> out = new ArtifactAssembler(store).assemble(ArtifactPolicy.strict("ids", 1), IDS);

            assertThrows(UnsupportedOperationException.class, () -> out.rows().add("x"));
        }
    }

    @Nested
    class MissingShards {

        @Test
        void strict_missingShard_throwsArtifactMissing() {
            InMemoryShardStore store = new InMemoryShardStore()
                    .put("predicted_ratings", 1, "[1]")
                    .put("predicted_ratings", 3, "[3]");

            ArtifactMissingException ex = assertThrows(ArtifactMissingException.class, () ->
                    new ArtifactAssembler(store).assemble(ArtifactPolicy.strict("predicted_ratings", 3), IDS));

            assertEquals("predicted_ratings", ex.artifact());
            assertEquals(2, ex.shardNumber());
        }

        @Test
        void tolerant_missingTrailingShard_doesNotThrow() {
            InMemoryShardStore store = new InMemoryShardStore()
                    .put("user_history", 1, "[{\"customer_id\": 1, \"mid\": \"A\"}]")
                    .put("user_history", 2, "[{\"customer_id\": 2, \"mid\": \"B\"}]");

            AssembledArtifact<PurchaseRecord> out = new ArtifactAssembler(store).assemble(
                    ArtifactPolicy.tolerant("user_history", 6), new JsonPurchaseShardDecoder(PurchaseFormat.DEFAULT));

            assertEquals(2, out.rowCount());
            assertEquals(List.of(1, 2), out.loadedShards());
            assertEquals(List.of(3, 4, 5, 6), out.missingShards());
            assertFalse(out.isComplete());
        }

        @Test
        void tolerant_missingMiddleShard_continuesWithLaterShards() {
            InMemoryShardStore store = new InMemoryShardStore()
                    .put("ids", 1, "[\"a\"]")
                    .put("ids", 3, "[\"c\"]");

            AssembledArtifact<String> out = new ArtifactAssembler(store).assemble(ArtifactPolicy.tolerant("ids", 3), IDS);

            assertEquals(List.of("a", "c"), out.rows());
            assertEquals(List.of(2), out.missingShards());
        }

        @Test
        void tolerant_allShardsMissing_returnsEmptyArtifact() {
            AssembledArtifact<String> out = new ArtifactAssembler(new InMemoryShardStore())
                    .assemble(ArtifactPolicy.tolerant("ids", 2), IDS);

            assertEquals(0, out.rowCount());
            assertEquals(List.of(1, 2), out.missingShards());
        }
    }

    @Nested
    class CorruptShards {

        @Test
        void malformedJson_throwsArtifactCorrupt_withShardName() {
            InMemoryShardStore store = new InMemoryShardStore()
                    .put("ids", 1, "[\"a\"]")
                    .put("ids", 2, "[\"b\", ");

            ArtifactCorruptException ex = assertThrows(ArtifactCorruptException.class, () ->
                    new ArtifactAssembler(store).assemble(ArtifactPolicy.tolerant("ids", 2), IDS));

            assertEquals("ids", ex.artifact());
            assertTrue(ex.getMessage().contains("ids_part2"));
            assertNotNull(ex.getCause());
        }

        @Test
        void invalidContent_throwsArtifactCorrupt() {
            InMemoryShardStore store = new InMemoryShardStore().put("ids", 1, "[\"a\", {\"x\": 1}]");

            assertThrows(ArtifactCorruptException.class, () ->
                    new ArtifactAssembler(store).assemble(ArtifactPolicy.strict("ids", 1), IDS));
        }

        @Test
        void corruptShard_evenUnderTolerantPolicy_abortsWholeAssembly() {
            InMemoryShardStore store = new InMemoryShardStore()
                    .put("user_history", 1, "[{\"customer_id\": 1, \"mid\": \"A\"}]")
                    .put("user_history", 2, "not json");

            assertThrows(ArtifactCorruptException.class, () ->
                    new ArtifactAssembler(store).assemble(
                            ArtifactPolicy.tolerant("user_history", 2),
                            new JsonPurchaseShardDecoder(PurchaseFormat.DEFAULT)));
        }
    }

    @Nested
    class PolicyValidation {

        @Test
        void policy_rejectsBadValues() {
            assertThrows(IllegalArgumentException.class, () -> ArtifactPolicy.strict("  ", 1));
            assertThrows(IllegalArgumentException.class, () -> ArtifactPolicy.strict("x", 0));
            assertThrows(IllegalArgumentException.class, () -> new ArtifactPolicy("x", 1, null));
        }

        @Test
        void assembler_rejectsNulls() {
            ArtifactAssembler assembler = new ArtifactAssembler(new InMemoryShardStore());
            assertThrows(NullPointerException.class, () -> assembler.assemble(null, IDS));
            assertThrows(NullPointerException.class, () -> assembler.assemble(ArtifactPolicy.strict("x", 1), null));
            assertThrows(NullPointerException.class, () -> new ArtifactAssembler(null));
        }
    }
}
