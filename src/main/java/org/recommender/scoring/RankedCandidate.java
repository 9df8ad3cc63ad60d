package org.recommender.scoring;

/**
 * A scored catalog item. {@code row} is the item's row in the catalog and breaks score ties.
 * Higher score means more relevant.
 */
public record RankedCandidate(String itemId, double score, int row) {
}
