package org.recommender.io.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import org.recommender.io.ShardDecoder;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Decodes an identifier-mapping shard: a JSON array whose i-th element is the
 * identifier of matrix row i. Elements may be strings or numbers.
 * <pre>
 * [ "A1", "A2", 77 ]
 * </pre>
 */
public final class JsonIdShardDecoder implements ShardDecoder<String> {

    @Override
    public List<String> decode(InputStream in) throws IOException {
        try (JsonParser p = JsonReading.parser(in)) {
            p.nextToken();
            JsonReading.expect(p, JsonToken.START_ARRAY, "an array of identifiers");

            List<String> ids = new ArrayList<>();
            while (p.nextToken() != JsonToken.END_ARRAY) {
                ids.add(JsonReading.readId(p, "id[" + ids.size() + "]"));
            }
            JsonReading.requireEndOfInput(p);
            return ids;
        }
    }
}
