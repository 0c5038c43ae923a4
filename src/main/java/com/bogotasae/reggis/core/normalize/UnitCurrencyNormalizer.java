package com.bogotasae.reggis.core.normalize;

import com.bogotasae.reggis.config.ConfigService;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Converts invoice quantities to the REGGIS canonical units and prices to Colombian pesos
 * using fixed multiplicative tables.
 * <p>
 * Codes that are not in the tables are not an error: the values pass through unconverted and the
 * result reports {@link NormalizedAmounts#normalized()} as {@code false}.
 */
public final class UnitCurrencyNormalizer {

    public static final int SCALE = 5;
    public static final String LOCAL_CURRENCY = "COP";

    private static final Map<String, UnitConversion> UNITS = buildUnitTable();
    private static final Map<String, String> REGGIS_CURRENCY_CODES = Map.of(
        "COP", "1",
        "USD", "2",
        "EUR", "3"
    );

    private final Map<String, BigDecimal> configuredRates;

    /**
     * @param configuredRates pesos per unit of foreign currency, keyed by ISO code; used when the
     *                        document does not state its own exchange rate
     */
    public UnitCurrencyNormalizer(Map<String, BigDecimal> configuredRates) {
        Map<String, BigDecimal> copy = new LinkedHashMap<>();
        if (configuredRates != null) {
            configuredRates.forEach((code, rate) -> {
                if (code != null && rate != null && rate.signum() > 0) {
                    copy.put(code.trim().toUpperCase(Locale.ROOT), rate);
                }
            });
        }
        this.configuredRates = Collections.unmodifiableMap(copy);
    }

    public static UnitCurrencyNormalizer withoutConfiguredRates() {
        return new UnitCurrencyNormalizer(Map.of());
    }

    public static UnitCurrencyNormalizer fromConfig(ConfigService config) {
        Map<String, BigDecimal> rates = new LinkedHashMap<>();
        config.getUsdRate().ifPresent(rate -> rates.put("USD", rate));
        config.getEurRate().ifPresent(rate -> rates.put("EUR", rate));
        return new UnitCurrencyNormalizer(rates);
    }

    /**
     * @param documentRate exchange rate stated on the invoice, or {@code null}
     */
    public NormalizedAmounts normalize(BigDecimal quantity,
                                       String unitCode,
                                       BigDecimal unitPrice,
                                       String currency,
                                       BigDecimal documentRate) {
        Objects.requireNonNull(quantity, "quantity");
        Objects.requireNonNull(unitPrice, "unitPrice");

        String rawUnit = unitCode == null ? "" : unitCode.trim();
        UnitConversion unit = UNITS.get(rawUnit.toUpperCase(Locale.ROOT));
        boolean unitKnown = unit != null;
        BigDecimal unitFactor = unitKnown ? unit.factor() : BigDecimal.ONE;
        String unitLabel = unitKnown ? unit.label() : rawUnit;

        String isoCurrency = currency == null || currency.isBlank()
            ? LOCAL_CURRENCY
            : currency.trim().toUpperCase(Locale.ROOT);
        BigDecimal currencyFactor = resolveCurrencyFactor(isoCurrency, documentRate);
        boolean currencyKnown = currencyFactor != null;
        String currencyCode = currencyKnown
            ? REGGIS_CURRENCY_CODES.get(LOCAL_CURRENCY)
            : REGGIS_CURRENCY_CODES.getOrDefault(isoCurrency, isoCurrency);

        BigDecimal normalizedQuantity = round(quantity.multiply(unitFactor));
        BigDecimal pricePerUnit = unitPrice.divide(unitFactor, MathContext.DECIMAL128);
        if (currencyKnown) {
            pricePerUnit = pricePerUnit.multiply(currencyFactor);
        }

        return new NormalizedAmounts(
            normalizedQuantity,
            round(pricePerUnit),
            unitLabel,
            currencyCode,
            unitKnown && currencyKnown
        );
    }

    /**
     * Rounds to the export precision using half-up semantics.
     */
    public static BigDecimal round(BigDecimal value) {
        return value.setScale(SCALE, RoundingMode.HALF_UP);
    }

    public static boolean isKnownUnit(String unitCode) {
        return unitCode != null && UNITS.containsKey(unitCode.trim().toUpperCase(Locale.ROOT));
    }

    private BigDecimal resolveCurrencyFactor(String isoCurrency, BigDecimal documentRate) {
        if (LOCAL_CURRENCY.equals(isoCurrency)) {
            return BigDecimal.ONE;
        }
        if (!REGGIS_CURRENCY_CODES.containsKey(isoCurrency)) {
            return null;
        }
        if (documentRate != null && documentRate.signum() > 0) {
            return documentRate;
        }
        return configuredRates.get(isoCurrency);
    }

    private static Map<String, UnitConversion> buildUnitTable() {
        Map<String, UnitConversion> table = new LinkedHashMap<>();
        table.put("KGM", new UnitConversion("Kg", BigDecimal.ONE));
        table.put("KG", new UnitConversion("Kg", BigDecimal.ONE));
        table.put("GRM", new UnitConversion("Kg", new BigDecimal("0.001")));
        table.put("TNE", new UnitConversion("Kg", new BigDecimal("1000")));
        table.put("LBR", new UnitConversion("Kg", new BigDecimal("0.45359237")));
        table.put("LTR", new UnitConversion("Lt", BigDecimal.ONE));
        table.put("LT", new UnitConversion("Lt", BigDecimal.ONE));
        for (String each : new String[]{"NIU", "EA", "EV", "JR", "UN", "94"}) {
            table.put(each, new UnitConversion("Un", BigDecimal.ONE));
        }
        return Collections.unmodifiableMap(table);
    }

    private record UnitConversion(String label, BigDecimal factor) {
    }
}
