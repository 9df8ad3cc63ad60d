package org.recommender.model;

import org.recommender.index.IdentityIndex;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable table of precomputed customer x item scores.
 * Row i belongs to {@code customers.idAt(i)}; column j belongs to {@code items.idAt(j)}.
 */
public final class ScoreTable {

    private final IdentityIndex customers;
    private final IdentityIndex items;
    private final double[][] scores;

    public ScoreTable(IdentityIndex customers, IdentityIndex items, double[][] scores) {
        this.customers = Objects.requireNonNull(customers, "customers must not be null");
        this.items = Objects.requireNonNull(items, "items must not be null");
        Objects.requireNonNull(scores, "scores must not be null");

        if (scores.length != customers.size()) {
            throw new IllegalArgumentException(
                    "Score rows (" + scores.length + ") do not match customer rows (" + customers.size() + ")"
            );
        }
        double[][] copy = new double[scores.length][];
        for (int row = 0; row < scores.length; row++) {
            double[] r = scores[row];
            if (r == null || r.length != items.size()) {
                throw new IllegalArgumentException(
                        "Score row " + row + " for customer '" + customers.idAt(row) + "' must have "
                                + items.size() + " columns"
                );
            }
            copy[row] = r.clone();
        }
        this.scores = copy;
    }

    public IdentityIndex customers() {
        return customers;
    }

    public IdentityIndex items() {
        return items;
    }

    /**
     * @return the score row for the customer, or empty if the customer has no row
     */
    public Optional<ScoreRow> row(Object customerId) {
        var row = customers.indexOf(customerId);
        if (row.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ScoreRow(scores[row.getAsInt()]));
    }

    /**
     * Read-only view over one customer's scores, indexed by item row.
     */
    public static final class ScoreRow {
        private final double[] values;

        private ScoreRow(double[] values) {
            this.values = values;
        }

        public double score(int itemRow) {
            return values[itemRow];
        }

        public int length() {
            return values.length;
        }
    }
}
