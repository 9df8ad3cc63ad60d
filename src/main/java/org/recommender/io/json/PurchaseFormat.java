package org.recommender.io.json;

/**
 * Describes how customer and item ids are stored in purchase-log objects.
 * Example object:
 * { "customer_id": 1024, "mid": "A1" }
 */
public record PurchaseFormat(String customerField, String itemField) {

    public static final PurchaseFormat DEFAULT = new PurchaseFormat("customer_id", "mid");

    public PurchaseFormat {
        if (customerField == null || customerField.isBlank()) {
            throw new IllegalArgumentException("customerField must be non-empty");
        }
        if (itemField == null || itemField.isBlank()) {
            throw new IllegalArgumentException("itemField must be non-empty");
        }
    }
}
