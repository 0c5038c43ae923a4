package com.bogotasae.reggis.core.model;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of selling organizations (SOCIEDAD) a material can be registered under.
 */
public enum LegalEntity {
    LACTALIS("800245795", "LACTALIS COLOMBIA S.A.S", List.of("parmalat", "lactalis")),
    PROLECHE("890903711", "PROCESADORA DE LECHES S.A. - PROLECHE S.A.", List.of("proleche", "procesadora de leches"));

    private final String taxId;
    private final String registeredName;
    private final List<String> aliases;

    LegalEntity(String taxId, String registeredName, List<String> aliases) {
        this.taxId = taxId;
        this.registeredName = registeredName;
        this.aliases = aliases;
    }

    public String taxId() {
        return taxId;
    }

    /**
     * Resolves free text from an import file (brand alias, registered name or tax ID) to a known entity.
     */
    public static Optional<LegalEntity> fromText(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT);
        for (LegalEntity entity : values()) {
            if (entity.taxId.equals(normalized)
                || entity.aliases.contains(normalized)
                || entity.registeredName.toLowerCase(Locale.ROOT).equals(normalized)) {
                return Optional.of(entity);
            }
        }
        return Optional.empty();
    }
}
