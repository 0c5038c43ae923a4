package com.bogotasae.reggis.core.validate;

import com.bogotasae.reggis.core.model.InvoiceLine;
import com.bogotasae.reggis.core.reference.ReferenceLookup;
import com.bogotasae.reggis.logging.AppLogger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Keeps only lines whose material and/or client are registered in the reference data.
 * The material check runs first, so a line failing both is reported as an unknown material.
 */
public final class ValidationFilter {
    private static final Logger LOGGER = AppLogger.get();

    private final ReferenceLookup lookup;
    private final boolean validateMaterials;
    private final boolean validateClients;

    public ValidationFilter(ReferenceLookup lookup, boolean validateMaterials, boolean validateClients) {
        if ((validateMaterials || validateClients) && lookup == null) {
            throw new IllegalArgumentException("A reference lookup is required when validation is enabled");
        }
        this.lookup = lookup;
        this.validateMaterials = validateMaterials;
        this.validateClients = validateClients;
    }

    public static ValidationFilter passThrough() {
        return new ValidationFilter(null, false, false);
    }

    public boolean isActive() {
        return validateMaterials || validateClients;
    }

    public Optional<Rejection> check(InvoiceLine line) {
        Objects.requireNonNull(line, "line");
        if (validateMaterials && !lookup.lookupMaterial(line.productCode(), line.effectiveEntityTaxId())) {
            return Optional.of(new Rejection(line.sourceName(), line.invoiceNumber(), RejectionReason.UNKNOWN_MATERIAL,
                line.productCode() + "@" + line.effectiveEntityTaxId()));
        }
        if (validateClients && !lookup.lookupClient(line.buyerTaxId())) {
            return Optional.of(new Rejection(line.sourceName(), line.invoiceNumber(), RejectionReason.UNKNOWN_CLIENT,
                line.buyerTaxId()));
        }
        return Optional.empty();
    }

    /**
     * Splits {@code lines} into accepted lines (order preserved) and rejections.
     */
    public Result apply(List<InvoiceLine> lines) {
        if (!isActive()) {
            return new Result(lines, List.of());
        }
        List<InvoiceLine> accepted = new ArrayList<>(lines.size());
        List<Rejection> rejections = new ArrayList<>();
        for (InvoiceLine line : lines) {
            Optional<Rejection> rejection = check(line);
            if (rejection.isPresent()) {
                rejections.add(rejection.get());
                LOGGER.fine(() -> "Rejected " + rejection.get());
            } else {
                accepted.add(line);
            }
        }
        return new Result(accepted, rejections);
    }

    public record Result(List<InvoiceLine> accepted, List<Rejection> rejections) {
        public Result {
            accepted = List.copyOf(accepted);
            rejections = List.copyOf(rejections);
        }
    }
}
