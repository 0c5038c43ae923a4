package com.bogotasae.reggis.core.xml;

import com.bogotasae.reggis.core.model.DocumentType;
import com.bogotasae.reggis.core.model.InvoiceLine;

import java.util.List;

/**
 * Outcome of reading one XML document.
 *
 * @param invalidLines notes for line items dropped by the quantity/price rules
 */
public record ExtractedDocument(String sourceName,
                                DocumentType type,
                                String invoiceNumber,
                                List<InvoiceLine> lines,
                                List<String> invalidLines) {

    public ExtractedDocument {
        lines = List.copyOf(lines);
        invalidLines = List.copyOf(invalidLines);
    }

    static ExtractedDocument skipped(String sourceName, DocumentType type) {
        return new ExtractedDocument(sourceName, type, "", List.of(), List.of());
    }

    public boolean isInvoice() {
        return type == DocumentType.INVOICE;
    }
}
