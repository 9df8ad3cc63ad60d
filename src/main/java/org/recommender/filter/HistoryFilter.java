package org.recommender.filter;

import org.recommender.scoring.RankedCandidate;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Drops already-purchased items from a ranked candidate list.
 *
 * Keeps the first n candidates whose item is not in the purchase set, in input order,
 * skipping repeated items. If fewer than n survive, all survivors are returned;
 * the result is never padded.
 */
public final class HistoryFilter {

    public List<String> filter(List<RankedCandidate> ranked, Set<String> purchased, int n) {
        Objects.requireNonNull(ranked, "ranked must not be null");
        Objects.requireNonNull(purchased, "purchased must not be null");
        if (n < 1) throw new IllegalArgumentException("n must be >= 1");

        List<String> out = new ArrayList<>(Math.min(n, ranked.size()));
        Set<String> seen = new HashSet<>();

        for (RankedCandidate c : ranked) {
            if (out.size() == n) {
                break;
            }
            String item = c.itemId();
            if (purchased.contains(item) || !seen.add(item)) {
                continue;
            }
            out.add(item);
        }
        return out;
    }
}
