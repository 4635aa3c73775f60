package dev.pekelund.docflow.model;

/**
 * Where a document's classified row lived when it was removed from downstream tables.
 */
public enum Placement {

    NONE,
    PENDING,
    INFLOW,
    OUTFLOW;

    public static Placement of(TransactionType type) {
        return type == TransactionType.OUTFLOW ? OUTFLOW : INFLOW;
    }
}
