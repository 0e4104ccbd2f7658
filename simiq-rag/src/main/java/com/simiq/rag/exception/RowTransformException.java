package com.simiq.rag.exception;

/**
 * A single catalog row could not be turned into an indexable product.
 * Scoped to that row: the batch pipeline logs it, skips the row and carries on.
 */
public class RowTransformException extends RuntimeException {

    public RowTransformException(String rowId, String message) {
        super(String.format("Row %s: %s", rowId, message));
    }

    public RowTransformException(String rowId, String message, Throwable cause) {
        super(String.format("Row %s: %s", rowId, message), cause);
    }
}
