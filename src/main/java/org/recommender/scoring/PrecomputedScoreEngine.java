package org.recommender.scoring;

import org.recommender.index.IdentityIndex;
import org.recommender.model.ScoreTable;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ranks items from a table of scores computed offline.
 * A customer without a row is a cold start and yields no ranking.
 */
public final class PrecomputedScoreEngine implements ScoringEngine {

    private final ScoreTable table;

    public PrecomputedScoreEngine(ScoreTable table) {
        this.table = Objects.requireNonNull(table, "table must not be null");
    }

    @Override
    public ScoringMode mode() {
        return ScoringMode.PRECOMPUTED_SCORES;
    }

    @Override
    public boolean knowsCustomer(Object customerId) {
        return table.customers().contains(customerId);
    }

    @Override
    public List<String> customers() {
        return table.customers().distinctIds();
    }

    @Override
    public int catalogSize() {
        return table.items().distinctSize();
    }

    @Override
    public Optional<List<RankedCandidate>> rank(Object customerId, int limit) {
        if (limit <= 0) throw new IllegalArgumentException("limit must be >= 1");

        Optional<ScoreTable.ScoreRow> row = table.row(customerId);
        if (row.isEmpty()) {
            return Optional.empty();
        }

        ScoreTable.ScoreRow scores = row.get();
        IdentityIndex items = table.items();
        TopCandidates top = new TopCandidates(limit);
        for (int col = 0; col < scores.length(); col++) {
            if (!items.isLive(col)) {
                continue;
            }
            top.offer(new RankedCandidate(items.idAt(col), scores.score(col), col));
        }
        return Optional.of(top.toRankedList());
    }
}
