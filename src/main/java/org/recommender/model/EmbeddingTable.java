package org.recommender.model;

import org.recommender.index.IdentityIndex;

import java.util.List;
import java.util.Objects;

/**
 * Immutable table of embedding vectors addressed by identifier or row.
 * All vectors share one dimension.
 */
public final class EmbeddingTable {

    private final IdentityIndex index;
    private final List<Vector> rows;
    private final int dimension;

    public EmbeddingTable(IdentityIndex index, List<Vector> rows) {
        this.index = Objects.requireNonNull(index, "index must not be null");
        Objects.requireNonNull(rows, "rows must not be null");
        if (rows.size() != index.size()) {
            throw new IllegalArgumentException(
                    "Vector rows (" + rows.size() + ") do not match identifier rows (" + index.size() + ")"
            );
        }
        if (rows.isEmpty()) {
            throw new IllegalArgumentException("EmbeddingTable cannot be empty");
        }

        int dim = rows.get(0).dim();
        for (int row = 0; row < rows.size(); row++) {
            Vector v = Objects.requireNonNull(rows.get(row), "vector must not be null at row " + row);
            if (v.dim() != dim) {
                throw new IllegalArgumentException(
                        "Inconsistent vector dimension: expected " + dim + " but got " + v.dim()
                                + " for id: " + index.idAt(row)
                );
            }
        }

        this.rows = List.copyOf(rows);
        this.dimension = dim;
    }

    public IdentityIndex index() {
        return index;
    }

    public int dimension() {
        return dimension;
    }

    public int size() {
        return rows.size();
    }

    public Vector vectorAt(int row) {
        return rows.get(row);
    }
}
