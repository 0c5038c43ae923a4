package com.bogotasae.reggis.core.validate;

import com.bogotasae.reggis.core.model.InvoiceLine;
import com.bogotasae.reggis.core.reference.ReferenceLookup;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ValidationFilterTest {

    private static final String LACTALIS = "800245795";

    private final ReferenceLookup lookup = new FixedLookup(Set.of("1001@" + LACTALIS), Set.of("900123456"));

    @Test
    void bothSwitchesOffPassesEverythingThrough() {
        List<InvoiceLine> lines = List.of(line("unknown", "unknown"));

        ValidationFilter.Result result = ValidationFilter.passThrough().apply(lines);

        assertEquals(lines, result.accepted());
        assertTrue(result.rejections().isEmpty());
    }

    @Test
    void materialCheckUsesEffectiveEntity() {
        ValidationFilter filter = new ValidationFilter(lookup, true, false);

        ValidationFilter.Result result = filter.apply(List.of(line("1001", "x"), line("2002", "x")));

        assertEquals(1, result.accepted().size());
        assertEquals("1001", result.accepted().get(0).productCode());
        Rejection rejection = result.rejections().get(0);
        assertEquals(RejectionReason.UNKNOWN_MATERIAL, rejection.reason());
        assertEquals("2002@" + LACTALIS, rejection.identifier());
    }

    @Test
    void materialFailureIsReportedBeforeClientFailure() {
        ValidationFilter filter = new ValidationFilter(lookup, true, true);

        Rejection rejection = filter.check(line("2002", "111")).orElseThrow();

        assertEquals(RejectionReason.UNKNOWN_MATERIAL, rejection.reason());
    }

    @Test
    void clientCheckAloneIgnoresMaterials() {
        ValidationFilter filter = new ValidationFilter(lookup, false, true);

        ValidationFilter.Result result = filter.apply(List.of(
            line("2002", "900123456"), line("1001", "111")));

        assertEquals(1, result.accepted().size());
        assertEquals("2002", result.accepted().get(0).productCode());
        assertEquals(RejectionReason.UNKNOWN_CLIENT, result.rejections().get(0).reason());
        assertEquals("111", result.rejections().get(0).identifier());
    }

    @Test
    void acceptedLinesKeepTheirOrder() {
        ValidationFilter filter = new ValidationFilter(lookup, true, true);
        InvoiceLine first = line("1001", "900123456");
        InvoiceLine second = line("1001", "900123456");

        assertEquals(List.of(first, second), filter.apply(List.of(first, line("9", "9"), second)).accepted());
    }

    @Test
    void enabledValidationNeedsALookup() {
        assertThrows(IllegalArgumentException.class, () -> new ValidationFilter(null, false, true));
    }

    static InvoiceLine line(String productCode, String buyerTaxId) {
        BigDecimal one = new BigDecimal("1.00000");
        return new InvoiceLine("test.xml", "FV-1", "PRODUCT", productCode, "Un", one, one,
            "2024-01-01", "2024-01-01", buyerTaxId, "BUYER", LACTALIS, "SELLER", "BOGOTA",
            new BigDecimal("19"), one, "1", one, new BigDecimal("0.19000"), new BigDecimal("1.19000"),
            LACTALIS, true);
    }

    private record FixedLookup(Set<String> materials, Set<String> clients) implements ReferenceLookup {
        @Override
        public boolean lookupMaterial(String code, String entityTaxId) {
            return materials.contains(code + "@" + entityTaxId);
        }

        @Override
        public boolean lookupClient(String taxId) {
            return clients.contains(taxId);
        }

        @Override
        public void close() {
        }
    }
}
