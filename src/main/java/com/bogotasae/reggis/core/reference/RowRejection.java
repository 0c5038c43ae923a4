package com.bogotasae.reggis.core.reference;

public record RowRejection(int rowNumber, String reason) {

    @Override
    public String toString() {
        return "row " + rowNumber + ": " + reason;
    }
}
