package org.recommender.io.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import org.recommender.io.ShardDecoder;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Decodes a precomputed-score shard:
 * <pre>
 * {
 *   "columns": ["A1", "A2", 77],
 *   "rows": [
 *     { "customer_id": 1024, "scores": [0.91, 0.15, null] }
 *   ]
 * }
 * </pre>
 * Column ids are canonicalized; a null score is read as NaN.
 * Each shard decodes to exactly one {@link ScoreShard}.
 */
public final class JsonScoreShardDecoder implements ShardDecoder<ScoreShard> {

    private final ScoreFormat format;

    public JsonScoreShardDecoder(ScoreFormat format) {
        this.format = Objects.requireNonNull(format, "format must not be null");
    }

    @Override
    public List<ScoreShard> decode(InputStream in) throws IOException {
        try (JsonParser p = JsonReading.parser(in)) {
            p.nextToken();
            JsonReading.expect(p, JsonToken.START_OBJECT, "a score shard object");

            List<String> columns = null;
            List<ScoreShardRow> rows = null;

            while (p.nextToken() != JsonToken.END_OBJECT) {
                String field = p.getCurrentName();
                p.nextToken();

                if (format.columnsField().equals(field)) {
                    columns = readColumns(p);
                } else if (format.rowsField().equals(field)) {
                    rows = readRows(p);
                } else {
                    p.skipChildren();
                }
            }
            JsonReading.requireEndOfInput(p);

            if (columns == null) {
                throw new IllegalArgumentException("Missing columns field '" + format.columnsField() + "'");
            }
            if (rows == null) {
                throw new IllegalArgumentException("Missing rows field '" + format.rowsField() + "'");
            }

            return List.of(new ScoreShard(columns, rows));
        }
    }

    private List<String> readColumns(JsonParser p) throws IOException {
        JsonReading.expect(p, JsonToken.START_ARRAY, "an array of column ids");
        List<String> columns = new ArrayList<>();
        while (p.nextToken() != JsonToken.END_ARRAY) {
            columns.add(JsonReading.readId(p, format.columnsField()));
        }
        return List.copyOf(columns);
    }

    private List<ScoreShardRow> readRows(JsonParser p) throws IOException {
        JsonReading.expect(p, JsonToken.START_ARRAY, "an array of score rows");
        List<ScoreShardRow> rows = new ArrayList<>();

        while (p.nextToken() != JsonToken.END_ARRAY) {
            JsonReading.expect(p, JsonToken.START_OBJECT, "a score row object");

            String id = null;
            double[] values = null;

            while (p.nextToken() != JsonToken.END_OBJECT) {
                String field = p.getCurrentName();
                p.nextToken();

                if (format.idField().equals(field)) {
                    id = JsonReading.readId(p, format.idField());
                } else if (format.scoresField().equals(field)) {
                    values = JsonReading.readDoubleArray(p, true);
                } else {
                    p.skipChildren();
                }
            }

            if (id == null) {
                throw new IllegalArgumentException("Missing id field '" + format.idField() + "' in score row " + rows.size());
            }
            if (values == null) {
                throw new IllegalArgumentException("Missing scores field '" + format.scoresField() + "' for id: " + id);
            }
            rows.add(new ScoreShardRow(id, values));
        }
        return rows;
    }
}
