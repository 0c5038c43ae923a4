package com.bogotasae.reggis.core.normalize;

import com.bogotasae.reggis.core.model.LegalEntity;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BrandEntityTableTest {

    private final BrandEntityTable table = BrandEntityTable.defaults();

    @Test
    void brandTokenOverridesSeller() {
        assertEquals("800245795", table.effectiveEntityTaxId("Leche parmalat deslactosada", "890903711"));
        assertEquals("890903711", table.effectiveEntityTaxId("KUMIS PROLECHE 1L", "800245795"));
    }

    @Test
    void firstRowWinsWhenBothTokensAppear() {
        assertEquals(Optional.of(LegalEntity.LACTALIS), table.match("PROLECHE CON PARMALAT"));
    }

    @Test
    void fallsBackToSellerWithoutToken() {
        assertEquals("900111222", table.effectiveEntityTaxId("QUESO CAMPESINO", " 900111222 "));
        assertTrue(table.match("").isEmpty());
    }

    @Test
    void customTableOrderIsRespected() {
        BrandEntityTable reversed = new BrandEntityTable(List.of(
            new BrandEntityTable.BrandToken("PROLECHE", LegalEntity.PROLECHE),
            new BrandEntityTable.BrandToken("PARMALAT", LegalEntity.LACTALIS)));

        assertEquals(Optional.of(LegalEntity.PROLECHE), reversed.match("PROLECHE CON PARMALAT"));
    }

    @Test
    void legalEntityResolvesAliasesAndTaxIds() {
        assertEquals(Optional.of(LegalEntity.LACTALIS), LegalEntity.fromText("  Parmalat "));
        assertEquals(Optional.of(LegalEntity.PROLECHE), LegalEntity.fromText("Procesadora de Leches"));
        assertEquals(Optional.of(LegalEntity.PROLECHE), LegalEntity.fromText("890903711"));
        assertEquals(Optional.of(LegalEntity.LACTALIS), LegalEntity.fromText("Lactalis Colombia S.A.S"));
        assertTrue(LegalEntity.fromText("ALPINA").isEmpty());
    }
}
