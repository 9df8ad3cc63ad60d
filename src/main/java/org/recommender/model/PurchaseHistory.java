package org.recommender.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable per-customer purchase history: the distinct items each customer
 * has bought, in first-seen order of the purchase log.
 */
public final class PurchaseHistory {

    private static final PurchaseHistory EMPTY = new PurchaseHistory(Map.of());

    private final Map<String, Set<String>> itemsByCustomer;

    private PurchaseHistory(Map<String, Set<String>> itemsByCustomer) {
        this.itemsByCustomer = itemsByCustomer;
    }

    public static PurchaseHistory empty() {
        return EMPTY;
    }

    /**
     * Collapses a purchase log (duplicates allowed) into distinct items per customer.
     */
    public static PurchaseHistory of(Collection<PurchaseRecord> records) {
        Objects.requireNonNull(records, "records must not be null");
        if (records.isEmpty()) {
            return EMPTY;
        }

        Map<String, Set<String>> grouped = new LinkedHashMap<>();
        for (PurchaseRecord r : records) {
            Objects.requireNonNull(r, "purchase record must not be null");
            grouped.computeIfAbsent(r.customerId(), k -> new LinkedHashSet<>()).add(r.itemId());
        }

        Map<String, Set<String>> frozen = new LinkedHashMap<>(grouped.size() * 2);
        for (var e : grouped.entrySet()) {
            frozen.put(e.getKey(), Collections.unmodifiableSet(e.getValue()));
        }
        return new PurchaseHistory(Collections.unmodifiableMap(frozen));
    }

    /**
     * @return distinct purchased items in first-seen order; empty if the customer bought nothing
     * @throws IllegalArgumentException if the identifier is malformed
     */
    public List<String> itemsOf(Object customerId) {
        return List.copyOf(purchasedSet(customerId));
    }

    /**
     * @return unmodifiable set view for membership checks
     */
    public Set<String> purchasedSet(Object customerId) {
        Set<String> items = itemsByCustomer.get(Ids.canonical(customerId));
        return items == null ? Set.of() : items;
    }

    public int customerCount() {
        return itemsByCustomer.size();
    }
}
