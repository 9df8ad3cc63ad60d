package org.recommender.app.service;

import org.recommender.app.api.RecommendationUseCases;
import org.recommender.app.api.dto.RecommendationResult;
import org.recommender.config.RecommenderConfig;
import org.recommender.filter.HistoryFilter;
import org.recommender.filter.OverfetchPolicy;
import org.recommender.model.Ids;
import org.recommender.scoring.RankedCandidate;
import org.recommender.scoring.ScoringEngine;
import org.recommender.scoring.ScoringMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Default {@link RecommendationUseCases} implementation.
 *
 * Each request reads the snapshot current at its start and never mutates it,
 * so the service is safe to call from many threads.
 *
 * Recommendations overfetch: the engine is asked for n + slack candidates, purchased
 * items are filtered out and the first n survivors returned. A short result is returned
 * as is unless the policy enables one refetch over the whole catalog.
 */
public final class RecommendationService implements RecommendationUseCases {

    private static final Logger log = LoggerFactory.getLogger(RecommendationService.class);

    private final SnapshotHolder snapshots;
    private final OverfetchPolicy policy;
    private final HistoryFilter filter = new HistoryFilter();

    public RecommendationService(SnapshotHolder snapshots, OverfetchPolicy policy) {
        this.snapshots = Objects.requireNonNull(snapshots, "snapshots must not be null");
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
    }

    public RecommendationService(RecommenderSnapshot snapshot, OverfetchPolicy policy) {
        this(new SnapshotHolder(snapshot), policy);
    }

    /**
     * Loads the artifacts named by the config and returns a ready service.
     *
     * @throws org.recommender.io.ArtifactException if the artifacts are missing or corrupt
     */
    public static RecommendationService fromConfig(RecommenderConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        RecommenderSnapshot snapshot = new SnapshotLoader(config).load();
        return new RecommendationService(snapshot, config.overfetch());
    }

    @Override
    public List<String> getHistory(Object customerId) {
        String id = Ids.canonical(customerId);
        return snapshots.current().history().itemsOf(id);
    }

    @Override
    public RecommendationResult getRecommendations(Object customerId, int n) {
        if (n < 1) throw new IllegalArgumentException("n must be >= 1, got " + n);
        String id = Ids.canonical(customerId);

        RecommenderSnapshot snapshot = snapshots.current();
        ScoringEngine engine = snapshot.engine();

        int limit = policy.candidateLimit(n);
        Optional<List<RankedCandidate>> ranked = engine.rank(id, limit);
        if (ranked.isEmpty()) {
            log.debug("Customer '{}' is unknown to the {} engine (cold start)", id, engine.mode());
            return RecommendationResult.unknownCustomer();
        }

        Set<String> purchased = snapshot.history().purchasedSet(id);
        List<String> items = filter.filter(ranked.get(), purchased, n);

        if (items.size() < n && policy.refetchOnShortfall() && limit < engine.catalogSize()) {
            log.debug("Customer '{}': {} of {} after filtering {} candidates; ranking full catalog",
                    id, items.size(), n, limit);
            List<RankedCandidate> all = engine.rank(id, engine.catalogSize()).orElse(List.of());
            items = filter.filter(all, purchased, n);
        } else if (items.size() < n) {
            log.debug("Customer '{}': returning {} of {} requested items", id, items.size(), n);
        }

        return RecommendationResult.found(items);
    }

    @Override
    public List<String> customers() {
        return snapshots.current().engine().customers();
    }

    @Override
    public ScoringMode mode() {
        return snapshots.current().engine().mode();
    }
}
