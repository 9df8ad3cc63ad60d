package org.recommender.scoring;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Keeps the best {@code limit} candidates seen so far using a bounded heap.
 *
 * The heap is ordered worst-first, so the worst kept candidate sits on top and is
 * evicted when a better one arrives.
 * Time: O(N log K) for N offers; space: O(K).
 */
public final class TopCandidates {

    private static final Comparator<RankedCandidate> WORST_FIRST = CandidateOrder.INSTANCE.reversed();

    private final int limit;
    private final PriorityQueue<RankedCandidate> heap;

    public TopCandidates(int limit) {
        if (limit <= 0) throw new IllegalArgumentException("limit must be >= 1");
        this.limit = limit;
        this.heap = new PriorityQueue<>(Math.min(limit, 1024) + 1, WORST_FIRST);
    }

    public void offer(RankedCandidate candidate) {
        if (heap.size() < limit) {
            heap.add(candidate);
        } else if (CandidateOrder.INSTANCE.compare(candidate, heap.peek()) < 0) {
            heap.poll();
            heap.add(candidate);
        }
    }

    /** @return kept candidates in ranking order (best first) */
    public List<RankedCandidate> toRankedList() {
        List<RankedCandidate> result = new ArrayList<>(heap);
        result.sort(CandidateOrder.INSTANCE);
        return result;
    }

    /**
     * Merges partial top lists (each computed over a disjoint slice of the catalog)
     * into one list of at most {@code limit} candidates in ranking order.
     */
    public static List<RankedCandidate> merge(List<List<RankedCandidate>> partials, int limit) {
        TopCandidates merged = new TopCandidates(limit);
        for (List<RankedCandidate> partial : partials) {
            for (RankedCandidate c : partial) {
                merged.offer(c);
            }
        }
        return merged.toRankedList();
    }
}
