package org.recommender.index;

import org.recommender.model.Ids;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Immutable bidirectional mapping between canonical identifiers and the dense
 * row indices used by the scoring tables.
 *
 * Identifiers are canonicalized with {@link Ids#canonical(Object)} before insertion.
 * When the same canonical identifier appears on several rows, the last row wins:
 * {@link #indexOf(Object)} resolves to it and the earlier rows are shadowed
 * ({@link #isLive(int)} returns false for them).
 */
public final class IdentityIndex {

    private final List<String> idsByRow;
    private final Map<String, Integer> rowById;
    private final boolean[] live;

    private IdentityIndex(List<String> idsByRow, Map<String, Integer> rowById, boolean[] live) {
        this.idsByRow = idsByRow;
        this.rowById = rowById;
        this.live = live;
    }

    /**
     * Builds the index from identifiers in row order.
     *
     * @param rawIds identifiers (strings or numbers), one per row
     * @throws IllegalArgumentException if any identifier cannot be canonicalized
     */
    public static IdentityIndex of(List<?> rawIds) {
        Objects.requireNonNull(rawIds, "rawIds must not be null");

        List<String> ids = new ArrayList<>(rawIds.size());
        Map<String, Integer> rows = new HashMap<>(Math.max(16, rawIds.size() * 2));

        for (int row = 0; row < rawIds.size(); row++) {
            String id;
            try {
                id = Ids.canonical(rawIds.get(row));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid identifier at row " + row + ": " + e.getMessage(), e);
            }
            ids.add(id);
            rows.put(id, row);
        }

        boolean[] live = new boolean[ids.size()];
        for (int row : rows.values()) {
            live[row] = true;
        }

        return new IdentityIndex(Collections.unmodifiableList(ids), Collections.unmodifiableMap(rows), live);
    }

    /**
     * @return the row of the identifier, or empty if it is unknown
     * @throws IllegalArgumentException if the identifier is malformed
     */
    public OptionalInt indexOf(Object id) {
        Integer row = rowById.get(Ids.canonical(id));
        return row == null ? OptionalInt.empty() : OptionalInt.of(row);
    }

    public boolean contains(Object id) {
        return indexOf(id).isPresent();
    }

    /**
     * @throws IndexOutOfBoundsException if the row is outside [0, size)
     */
    public String idAt(int row) {
        return idsByRow.get(row);
    }

    /** @return false for rows shadowed by a later duplicate identifier */
    public boolean isLive(int row) {
        if (row < 0 || row >= live.length) {
            throw new IndexOutOfBoundsException("row=" + row + ", size=" + live.length);
        }
        return live[row];
    }

    /** Number of rows, shadowed duplicates included. */
    public int size() {
        return idsByRow.size();
    }

    /** Number of distinct canonical identifiers. */
    public int distinctSize() {
        return rowById.size();
    }

    /** Distinct identifiers in row order of their winning row. */
    public List<String> distinctIds() {
        List<String> out = new ArrayList<>(rowById.size());
        for (int row = 0; row < idsByRow.size(); row++) {
            if (live[row]) {
                out.add(idsByRow.get(row));
            }
        }
        return Collections.unmodifiableList(out);
    }

    @Override
    public String toString() {
        return "IdentityIndex(rows=" + size() + ", distinct=" + distinctSize() + ")";
    }
}
