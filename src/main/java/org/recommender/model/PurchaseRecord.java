package org.recommender.model;

/**
 * One line of the purchase log. Identifiers are canonical.
 */
public record PurchaseRecord(String customerId, String itemId) {

    public PurchaseRecord {
        customerId = Ids.canonical(customerId);
        itemId = Ids.canonical(itemId);
    }
}
