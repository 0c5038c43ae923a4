package com.bogotasae.reggis.core.fs;

/**
 * Raw bytes of one XML document together with a display name ({@code file.xml} or {@code archive.zip/entry.xml}).
 */
public record InvoiceDocument(String sourceName, byte[] content) {
}
