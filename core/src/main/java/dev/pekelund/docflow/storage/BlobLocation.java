package dev.pekelund.docflow.storage;

import dev.pekelund.docflow.model.TransactionType;

/**
 * Subtrees of a tenant's blob root.
 */
public enum BlobLocation {

    STAGING("staging"),
    INFLOW("inflow"),
    OUTFLOW("outflow");

    private final String segment;

    BlobLocation(String segment) {
        this.segment = segment;
    }

    public String segment() {
        return segment;
    }

    public boolean isCategory() {
        return this != STAGING;
    }

    public static BlobLocation forCategory(TransactionType type) {
        return type == TransactionType.OUTFLOW ? OUTFLOW : INFLOW;
    }
}
