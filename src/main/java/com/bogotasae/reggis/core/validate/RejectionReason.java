package com.bogotasae.reggis.core.validate;

public enum RejectionReason {
    /** product code not registered for the line's legal entity */
    UNKNOWN_MATERIAL,
    /** buyer tax ID not registered as a client */
    UNKNOWN_CLIENT
}
