package org.recommender.io.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import org.recommender.io.ShardDecoder;
import org.recommender.model.Vector;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Decodes an embedding-matrix shard: a JSON array of equal-length number arrays,
 * one per row.
 * <pre>
 * [ [0.1, 0.2, 0.3], [0.4, 0.5, 0.6] ]
 * </pre>
 */
public final class JsonMatrixShardDecoder implements ShardDecoder<Vector> {

    @Override
    public List<Vector> decode(InputStream in) throws IOException {
        try (JsonParser p = JsonReading.parser(in)) {
            p.nextToken();
            JsonReading.expect(p, JsonToken.START_ARRAY, "a matrix (array of rows)");

            List<Vector> rows = new ArrayList<>();
            Integer dim = null;

            while (p.nextToken() != JsonToken.END_ARRAY) {
                double[] values = JsonReading.readDoubleArray(p, false);
                if (values.length == 0) {
                    throw new IllegalArgumentException("Vector must not be empty at row " + rows.size());
                }
                if (dim == null) {
                    dim = values.length;
                } else if (values.length != dim) {
                    throw new IllegalArgumentException("Inconsistent vector dimension: expected " + dim
                            + " but got " + values.length + " at row " + rows.size());
                }
                rows.add(new Vector(values));
            }
            JsonReading.requireEndOfInput(p);
            return rows;
        }
    }
}
