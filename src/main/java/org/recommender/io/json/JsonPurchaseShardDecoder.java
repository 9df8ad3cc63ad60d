package org.recommender.io.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import org.recommender.io.ShardDecoder;
import org.recommender.model.PurchaseRecord;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Decodes a purchase-history shard: an array of (customer, item) objects.
 * <pre>
 * [ { "customer_id": 1024, "mid": "A1" }, { "customer_id": "1024", "mid": "A2" } ]
 * </pre>
 * Duplicates are kept; they collapse later in {@link org.recommender.model.PurchaseHistory}.
 */
public final class JsonPurchaseShardDecoder implements ShardDecoder<PurchaseRecord> {

    private final PurchaseFormat format;

    public JsonPurchaseShardDecoder(PurchaseFormat format) {
        this.format = Objects.requireNonNull(format, "format must not be null");
    }

    @Override
    public List<PurchaseRecord> decode(InputStream in) throws IOException {
        try (JsonParser p = JsonReading.parser(in)) {
            p.nextToken();
            JsonReading.expect(p, JsonToken.START_ARRAY, "an array of purchase records");

            List<PurchaseRecord> records = new ArrayList<>();
            while (p.nextToken() != JsonToken.END_ARRAY) {
                JsonReading.expect(p, JsonToken.START_OBJECT, "a purchase record object");

                String customer = null;
                String item = null;
                while (p.nextToken() != JsonToken.END_OBJECT) {
                    String field = p.getCurrentName();
                    p.nextToken();

                    if (format.customerField().equals(field)) {
                        customer = JsonReading.readId(p, format.customerField());
                    } else if (format.itemField().equals(field)) {
                        item = JsonReading.readId(p, format.itemField());
                    } else {
                        p.skipChildren();
                    }
                }

                if (customer == null || item == null) {
                    throw new IllegalArgumentException("Purchase record " + records.size() + " must have both '"
                            + format.customerField() + "' and '" + format.itemField() + "'");
                }
                records.add(new PurchaseRecord(customer, item));
            }
            JsonReading.requireEndOfInput(p);
            return records;
        }
    }
}
