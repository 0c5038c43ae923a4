package com.bogotasae.reggis.core.export;

import java.util.Locale;
import java.util.Optional;

/**
 * Side of the trade the exported invoices describe. Fills the {@code Principal V,C} and activation columns.
 */
public enum ExportMode {
    /** Invoices issued by the entity: principal {@code V}, invoice and warehouse active. */
    SALES("V", "1"),
    /** Invoices received by the entity: principal {@code C}, activation columns left blank. */
    PURCHASES("C", "");

    private final String principal;
    private final String activeFlag;

    ExportMode(String principal, String activeFlag) {
        this.principal = principal;
        this.activeFlag = activeFlag;
    }

    public String principal() {
        return principal;
    }

    public String activeFlag() {
        return activeFlag;
    }

    /**
     * Accepts the enum name or the principal letter, case-insensitively.
     */
    public static Optional<ExportMode> fromText(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String normalized = text.trim().toUpperCase(Locale.ROOT);
        for (ExportMode mode : values()) {
            if (mode.name().equals(normalized) || mode.principal.equals(normalized)) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }
}
