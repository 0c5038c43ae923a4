package com.bogotasae.reggis.core.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One product line of an invoice, already normalized to kilograms (or the canonical unit label)
 * and to Colombian pesos where a conversion was known.
 *
 * @param sourceName           file (or {@code archive/entry}) the line was read from
 * @param unit                 canonical unit label ({@code Kg}, {@code Lt}, {@code Un}) or the raw code
 * @param quantity             normalized quantity, 5 decimals
 * @param unitPrice            normalized unit price, 5 decimals
 * @param originalQuantity     quantity as stated on the invoice
 * @param currencyCode         REGGIS currency code ({@code 1}, {@code 2}, {@code 3}) or the raw ISO code
 * @param effectiveEntityTaxId legal entity used for material lookups
 * @param normalized           {@code false} when the unit or currency passed through unconverted
 */
public record InvoiceLine(String sourceName,
                          String invoiceNumber,
                          String productName,
                          String productCode,
                          String unit,
                          BigDecimal quantity,
                          BigDecimal unitPrice,
                          String invoiceDate,
                          String paymentDate,
                          String buyerTaxId,
                          String buyerName,
                          String sellerTaxId,
                          String sellerName,
                          String municipality,
                          BigDecimal taxPercent,
                          BigDecimal originalQuantity,
                          String currencyCode,
                          BigDecimal totalWithoutTax,
                          BigDecimal taxAmount,
                          BigDecimal totalWithTax,
                          String effectiveEntityTaxId,
                          boolean normalized) {

    public InvoiceLine {
        Objects.requireNonNull(invoiceNumber, "invoiceNumber");
        Objects.requireNonNull(quantity, "quantity");
        Objects.requireNonNull(unitPrice, "unitPrice");
        Objects.requireNonNull(taxPercent, "taxPercent");
        Objects.requireNonNull(totalWithoutTax, "totalWithoutTax");
        Objects.requireNonNull(taxAmount, "taxAmount");
        Objects.requireNonNull(totalWithTax, "totalWithTax");
        productName = nullToEmpty(productName);
        productCode = nullToEmpty(productCode);
        unit = nullToEmpty(unit);
        invoiceDate = nullToEmpty(invoiceDate);
        paymentDate = nullToEmpty(paymentDate);
        buyerTaxId = nullToEmpty(buyerTaxId);
        buyerName = nullToEmpty(buyerName);
        sellerTaxId = nullToEmpty(sellerTaxId);
        sellerName = nullToEmpty(sellerName);
        municipality = nullToEmpty(municipality);
        currencyCode = nullToEmpty(currencyCode);
        effectiveEntityTaxId = nullToEmpty(effectiveEntityTaxId);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value.trim();
    }
}
