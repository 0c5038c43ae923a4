package com.bogotasae.reggis.core.reference;

/**
 * Raised when a reference workbook does not have the expected header row or cannot be read as a workbook.
 */
public final class FormatInvalidException extends Exception {

    public FormatInvalidException(String message) {
        super(message);
    }

    public FormatInvalidException(String message, Throwable cause) {
        super(message, cause);
    }
}
