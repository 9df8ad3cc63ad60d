package org.recommender.scoring;

import java.util.Comparator;

/**
 * Ranking order for candidates: descending score, NaN scores last,
 * ties broken by ascending catalog row.
 *
 * Non-NaN scores follow {@link Double#compare(double, double)}, so -0.0 ranks below 0.0.
 */
public final class CandidateOrder implements Comparator<RankedCandidate> {

    public static final CandidateOrder INSTANCE = new CandidateOrder();

    private CandidateOrder() {
    }

    @Override
    public int compare(RankedCandidate a, RankedCandidate b) {
        int byScore = compareScores(a.score(), b.score());
        if (byScore != 0) {
            return byScore;
        }
        return Integer.compare(a.row(), b.row());
    }

    /** Negative when {@code a} ranks before {@code b}. */
    static int compareScores(double a, double b) {
        boolean aNaN = Double.isNaN(a);
        boolean bNaN = Double.isNaN(b);
        if (aNaN || bNaN) {
            return Boolean.compare(aNaN, bNaN);
        }
        return Double.compare(b, a);
    }
}
