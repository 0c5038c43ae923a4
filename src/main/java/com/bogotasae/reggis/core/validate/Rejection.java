package com.bogotasae.reggis.core.validate;

/**
 * A line refused by the validation filter, with the identifiers that failed to resolve.
 *
 * @param identifier product code and entity for {@link RejectionReason#UNKNOWN_MATERIAL}, buyer tax ID otherwise
 */
public record Rejection(String sourceName, String invoiceNumber, RejectionReason reason, String identifier) {

    @Override
    public String toString() {
        return sourceName + " #" + invoiceNumber + ": " + reason + " (" + identifier + ")";
    }
}
