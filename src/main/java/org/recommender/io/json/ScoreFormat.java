package org.recommender.io.json;

/**
 * Describes the field names of a precomputed-score shard.
 * Example shard:
 * { "columns": ["A1", "A2"], "rows": [ { "customer_id": 1024, "scores": [0.9, 0.1] } ] }
 */
public record ScoreFormat(String columnsField, String rowsField, String idField, String scoresField) {

    public static final ScoreFormat DEFAULT = new ScoreFormat("columns", "rows", "customer_id", "scores");

    public ScoreFormat {
        requireField(columnsField, "columnsField");
        requireField(rowsField, "rowsField");
        requireField(idField, "idField");
        requireField(scoresField, "scoresField");
    }

    private static void requireField(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must be non-empty");
        }
    }
}
