package com.bogotasae.reggis.core.model;

/**
 * UBL root element kinds seen in a DIAN delivery. Only {@link #INVOICE} produces export lines.
 */
public enum DocumentType {
    INVOICE("Invoice"),
    CREDIT_NOTE("CreditNote"),
    DEBIT_NOTE("DebitNote"),
    ATTACHED_DOCUMENT("AttachedDocument"),
    OTHER("");

    private final String rootElement;

    DocumentType(String rootElement) {
        this.rootElement = rootElement;
    }

    public static DocumentType fromRootElement(String localName) {
        for (DocumentType type : values()) {
            if (type != OTHER && type.rootElement.equals(localName)) {
                return type;
            }
        }
        return OTHER;
    }
}
