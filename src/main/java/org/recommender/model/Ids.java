package org.recommender.model;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Canonical string form for customer and item identifiers.
 *
 * Artifacts mix numeric and textual forms of the same identifier
 * (e.g. 1024, 1024.0 and "1024"). Every ingestion boundary (shard decoding,
 * query input) goes through {@link #canonical(Object)} so lookups and
 * comparisons only ever see one representation.
 */
public final class Ids {

    private Ids() {
    }

    /**
     * Normalization rule:
     * - strings: strip leading/trailing whitespace, blank is rejected
     * - integral numbers: plain decimal text
     * - floating numbers: integral text when there is no fractional part, otherwise plain decimal text
     *
     * @throws IllegalArgumentException for null, blank, NaN/infinite or unsupported values
     */
    public static String canonical(Object raw) {
        if (raw == null) {
            throw new IllegalArgumentException("identifier must not be null");
        }
        if (raw instanceof String s) {
            String stripped = s.strip();
            if (stripped.isEmpty()) {
                throw new IllegalArgumentException("identifier must not be blank");
            }
            return stripped;
        }
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte
                || raw instanceof BigInteger) {
            return raw.toString();
        }
        if (raw instanceof Double || raw instanceof Float) {
            double d = ((Number) raw).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new IllegalArgumentException("identifier must be a finite number: " + raw);
            }
            return plain(BigDecimal.valueOf(d));
        }
        if (raw instanceof BigDecimal bd) {
            return plain(bd);
        }
        throw new IllegalArgumentException(
                "Unsupported identifier type: " + raw.getClass().getName() + " (" + raw + ")"
        );
    }

    private static String plain(BigDecimal value) {
        BigDecimal stripped = value.stripTrailingZeros();
        if (stripped.scale() <= 0) {
            return stripped.toBigInteger().toString();
        }
        return stripped.toPlainString();
    }
}
