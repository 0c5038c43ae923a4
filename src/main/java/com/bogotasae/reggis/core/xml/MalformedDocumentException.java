package com.bogotasae.reggis.core.xml;

/**
 * Raised when an invoice document cannot be parsed or lacks an element the export needs.
 * The batch skips the document and continues.
 */
public final class MalformedDocumentException extends Exception {
    private final String sourceName;

    public MalformedDocumentException(String sourceName, String message) {
        super(sourceName + ": " + message);
        this.sourceName = sourceName;
    }

    public MalformedDocumentException(String sourceName, String message, Throwable cause) {
        super(sourceName + ": " + message, cause);
        this.sourceName = sourceName;
    }

    public String getSourceName() {
        return sourceName;
    }
}
