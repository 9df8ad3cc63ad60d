package org.recommender.scoring;

/**
 * Customer and item embeddings have different dimensions, so inner products are undefined.
 * Indicates the two embedding artifacts come from different model builds.
 */
public final class DimensionMismatchException extends IllegalStateException {

    private final int customerDimension;
    private final int itemDimension;

    public DimensionMismatchException(int customerDimension, int itemDimension) {
        super("Dimension mismatch: customer vectors have " + customerDimension
                + " components but item vectors have " + itemDimension);
        this.customerDimension = customerDimension;
        this.itemDimension = itemDimension;
    }

    public int customerDimension() {
        return customerDimension;
    }

    public int itemDimension() {
        return itemDimension;
    }
}
