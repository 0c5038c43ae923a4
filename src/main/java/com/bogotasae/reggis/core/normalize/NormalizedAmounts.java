package com.bogotasae.reggis.core.normalize;

import java.math.BigDecimal;

/**
 * Quantity and unit price after unit and currency conversion.
 *
 * @param normalized {@code false} if either the unit or the currency passed through verbatim
 */
public record NormalizedAmounts(BigDecimal quantity,
                                BigDecimal unitPrice,
                                String unit,
                                String currencyCode,
                                boolean normalized) {
}
