package org.recommender.app.service;

import org.recommender.config.RecommenderConfig;
import org.recommender.index.IdentityIndex;
import org.recommender.io.ArtifactAssembler;
import org.recommender.io.ArtifactCorruptException;
import org.recommender.io.ArtifactMissingException;
import org.recommender.io.ArtifactPolicy;
import org.recommender.io.AssembledArtifact;
import org.recommender.io.FileShardStore;
import org.recommender.io.ShardStore;
import org.recommender.io.json.JsonIdShardDecoder;
import org.recommender.io.json.JsonMatrixShardDecoder;
import org.recommender.io.json.JsonPurchaseShardDecoder;
import org.recommender.io.json.JsonScoreShardDecoder;
import org.recommender.io.json.ScoreShard;
import org.recommender.io.json.ScoreShardRow;
import org.recommender.model.EmbeddingTable;
import org.recommender.model.PurchaseHistory;
import org.recommender.model.PurchaseRecord;
import org.recommender.model.ScoreTable;
import org.recommender.model.Vector;
import org.recommender.scoring.PrecomputedScoreEngine;
import org.recommender.scoring.ScoringEngine;
import org.recommender.scoring.ScoringMode;
import org.recommender.scoring.VectorSearchEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds a {@link RecommenderSnapshot} from static artifacts. Runs once at startup
 * (or once per refresh) and is not meant to be called concurrently.
 *
 * The scoring mode is chosen from what is present: any ratings shard selects
 * precomputed scores, otherwise any customer-vector shard selects vector search.
 * If neither exists the ratings artifact is reported missing. Every ratings shard,
 * including one without rows, must carry the same item columns.
 */
public final class SnapshotLoader {

    private static final Logger log = LoggerFactory.getLogger(SnapshotLoader.class);

    private final RecommenderConfig config;
    private final ShardStore store;
    private final ArtifactAssembler assembler;

    public SnapshotLoader(RecommenderConfig config) {
        this(config, new FileShardStore(config.artifactPath()));
    }

    public SnapshotLoader(RecommenderConfig config, ShardStore store) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.assembler = new ArtifactAssembler(store);
    }

    /**
     * @throws ArtifactMissingException if a required shard is absent
     * @throws ArtifactCorruptException if a shard cannot be decoded or artifacts disagree
     */
    public RecommenderSnapshot load() {
        ScoringMode mode = detectMode();
        log.info("Loading recommender artifacts from {} (mode={})", store, mode);

        ScoringEngine engine = mode == ScoringMode.PRECOMPUTED_SCORES ? loadPrecomputed() : loadVectors();
        try {
            PurchaseHistory history = loadHistory();
            return new RecommenderSnapshot(engine, history);
        } catch (RuntimeException e) {
            engine.close();
            throw e;
        }
    }

    ScoringMode detectMode() {
        if (anyShardPresent(config.ratings())) {
            return ScoringMode.PRECOMPUTED_SCORES;
        }
        if (anyShardPresent(config.customerVectors())) {
            return ScoringMode.VECTOR_SEARCH;
        }
        throw new ArtifactMissingException(config.ratings().baseName(), 0,
                "Neither '" + config.ratings().baseName() + "' nor '" + config.customerVectors().baseName()
                        + "' artifacts were found in " + store);
    }

    // Any shard counts: a partially present artifact selects its mode and then fails strict assembly.
    private boolean anyShardPresent(ArtifactPolicy policy) {
        for (int shard = 1; shard <= policy.maxShards(); shard++) {
            if (store.locate(policy.baseName(), shard).isPresent()) {
                return true;
            }
        }
        return false;
    }

    private ScoringEngine loadPrecomputed() {
        ArtifactPolicy policy = config.ratings();
        AssembledArtifact<ScoreShard> ratings =
                assembler.assemble(policy, new JsonScoreShardDecoder(config.scoreFormat()));

        List<String> columns = ratings.rows().isEmpty() ? List.of() : ratings.rows().get(0).columns();
        List<String> customerIds = new ArrayList<>();
        List<double[]> scores = new ArrayList<>();

        for (int i = 0; i < ratings.rowCount(); i++) {
            ScoreShard shard = ratings.rows().get(i);
            if (!shard.columns().equals(columns)) {
                throw new ArtifactCorruptException(policy.baseName(),
                        "Shard " + ratings.loadedShards().get(i) + " of '" + policy.baseName()
                                + "' disagrees with shard " + ratings.loadedShards().get(0) + " on item columns");
            }
            for (ScoreShardRow row : shard.rows()) {
                customerIds.add(row.customerId());
                scores.add(row.scores());
            }
        }

        IdentityIndex customers = IdentityIndex.of(customerIds);
        IdentityIndex items = IdentityIndex.of(columns);
        warnOnDuplicates(policy.baseName() + " customers", customers);
        warnOnDuplicates(policy.baseName() + " columns", items);

        return new PrecomputedScoreEngine(new ScoreTable(customers, items, scores.toArray(new double[0][])));
    }

    private ScoringEngine loadVectors() {
        EmbeddingTable customers = loadEmbeddings(config.customerVectors(), config.customerIds());
        EmbeddingTable items = loadEmbeddings(config.itemVectors(), config.itemIds());

        if (customers.dimension() != items.dimension()) {
            log.warn("Customer vectors have dimension {} but item vectors have {}; queries will fail",
                    customers.dimension(), items.dimension());
        }
        return VectorSearchEngine.withThreads(customers, items, config.scoringThreads());
    }

    private EmbeddingTable loadEmbeddings(ArtifactPolicy vectorPolicy, ArtifactPolicy idPolicy) {
        AssembledArtifact<Vector> vectors = assembler.assemble(vectorPolicy, new JsonMatrixShardDecoder());
        AssembledArtifact<String> ids = assembler.assemble(idPolicy, new JsonIdShardDecoder());

        if (vectors.rowCount() != ids.rowCount()) {
            throw new ArtifactCorruptException(vectorPolicy.baseName(),
                    "'" + vectorPolicy.baseName() + "' has " + vectors.rowCount() + " rows but '"
                            + idPolicy.baseName() + "' has " + ids.rowCount() + " identifiers");
        }

        try {
            IdentityIndex index = IdentityIndex.of(ids.rows());
            warnOnDuplicates(idPolicy.baseName(), index);
            return new EmbeddingTable(index, vectors.rows());
        } catch (IllegalArgumentException e) {
            throw new ArtifactCorruptException(vectorPolicy.baseName(),
                    "Cannot build embedding table from '" + vectorPolicy.baseName() + "': " + e.getMessage(), e);
        }
    }

    private PurchaseHistory loadHistory() {
        AssembledArtifact<PurchaseRecord> records =
                assembler.assemble(config.history(), new JsonPurchaseShardDecoder(config.historyFormat()));
        PurchaseHistory history = PurchaseHistory.of(records.rows());
        log.info("Purchase history: {} records for {} customers", records.rowCount(), history.customerCount());
        return history;
    }

    private static void warnOnDuplicates(String what, IdentityIndex index) {
        int duplicates = index.size() - index.distinctSize();
        if (duplicates > 0) {
            log.warn("{}: {} duplicate identifier row(s) collapsed; last occurrence wins", what, duplicates);
        }
    }
}
