package org.recommender.io.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import org.recommender.model.Ids;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;

/**
 * Streaming helpers shared by the JSON shard decoders.
 */
final class JsonReading {

    // NaN / Infinity tokens are accepted: score exports may contain them.
    private static final JsonFactory FACTORY = JsonFactory.builder()
            .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
            .build();

    private JsonReading() {
    }

    static JsonParser parser(InputStream in) throws IOException {
        return FACTORY.createParser(in);
    }

    static void expect(JsonParser p, JsonToken expected, String what) throws IOException {
        if (p.currentToken() != expected) {
            throw new IllegalArgumentException("Expected " + what + " but found " + p.currentToken()
                    + " at " + p.getCurrentLocation());
        }
    }

    /**
     * Reads an identifier at the current token (string or number) and canonicalizes it.
     */
    static String readId(JsonParser p, String field) throws IOException {
        JsonToken t = p.currentToken();
        Object raw;
        if (t == JsonToken.VALUE_STRING) {
            raw = p.getText();
        } else if (t == JsonToken.VALUE_NUMBER_INT || t == JsonToken.VALUE_NUMBER_FLOAT) {
            raw = p.getNumberValue();
        } else {
            throw new IllegalArgumentException("Field '" + field + "' must be a string or number but was " + t);
        }
        return Ids.canonical(raw);
    }

    /**
     * Reads a JSON array of numbers at the current token.
     *
     * @param nullAsNaN whether JSON null elements are read as NaN (score exports) or rejected (vectors)
     */
    static double[] readDoubleArray(JsonParser p, boolean nullAsNaN) throws IOException {
        if (p.currentToken() != JsonToken.START_ARRAY) {
            throw new IllegalArgumentException("Expected a JSON array of numbers but found " + p.currentToken());
        }

        double[] buffer = new double[64];
        int size = 0;

        while (p.nextToken() != JsonToken.END_ARRAY) {
            JsonToken t = p.currentToken();
            double value;
            if (t == null) {
                throw new IllegalArgumentException("Unexpected end of input inside a number array");
            } else if (t.isNumeric()) {
                value = p.getDoubleValue();
            } else if (t == JsonToken.VALUE_NULL && nullAsNaN) {
                value = Double.NaN;
            } else {
                throw new IllegalArgumentException("Number array must contain numbers only, found " + t);
            }

            if (size == buffer.length) {
                buffer = Arrays.copyOf(buffer, buffer.length * 2);
            }
            buffer[size++] = value;
        }

        return Arrays.copyOf(buffer, size);
    }

    static void requireEndOfInput(JsonParser p) throws IOException {
        JsonToken trailing = p.nextToken();
        if (trailing != null) {
            throw new IllegalArgumentException("Unexpected trailing content: " + trailing);
        }
    }
}
