package org.recommender.filter;

/**
 * How many extra candidates to request so that filtering out purchased items still
 * leaves {@code n} results.
 *
 * @param slack extra candidates requested beyond n (>= 0)
 * @param refetchOnShortfall when the filtered first pass is short, rank the whole catalog once more;
 *                           when false the short result is returned as is
 */
public record OverfetchPolicy(int slack, boolean refetchOnShortfall) {

    public static final int DEFAULT_SLACK = 100;

    public static final OverfetchPolicy DEFAULT = new OverfetchPolicy(DEFAULT_SLACK, false);

    public OverfetchPolicy {
        if (slack < 0) {
            throw new IllegalArgumentException("slack must be >= 0, got " + slack);
        }
    }

    /** n + slack, saturating at Integer.MAX_VALUE. */
    public int candidateLimit(int n) {
        if (n < 1) throw new IllegalArgumentException("n must be >= 1");
        long limit = (long) n + slack;
        return (int) Math.min(limit, Integer.MAX_VALUE);
    }
}
