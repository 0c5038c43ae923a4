package com.bogotasae.reggis.core.reference;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReferenceStoreTest {

    private ReferenceStore store;

    @BeforeEach
    void openStore() throws Exception {
        store = ReferenceStore.inMemory("ref-" + UUID.randomUUID());
    }

    @AfterEach
    void closeStore() {
        store.close();
    }

    @Test
    void importsMaterialsResolvingEntityAliases() throws Exception {
        ImportSummary summary = store.importMaterials(List.of(
            new MaterialRow(2, "1001", "LECHE ENTERA", "Parmalat"),
            new MaterialRow(3, "1001", "LECHE ENTERA", "PROLECHE"),
            new MaterialRow(4, "2002", "QUESO", "800245795")
        ));

        assertEquals(3, summary.inserted());
        assertEquals(0, summary.rejected());
        assertTrue(store.lookupMaterial("1001", "800245795"));
        assertTrue(store.lookupMaterial("1001", "890903711"));
        assertTrue(store.lookupMaterial(" 2002 ", "800245795"));
        assertFalse(store.lookupMaterial("2002", "890903711"));
    }

    @Test
    void rejectsIncompleteRowsAndUnknownEntities() throws Exception {
        ImportSummary summary = store.importMaterials(List.of(
            new MaterialRow(2, "", "SIN CODIGO", "lactalis"),
            new MaterialRow(3, "1", "", "lactalis"),
            new MaterialRow(4, "2", "YOGURT", ""),
            new MaterialRow(5, "3", "AREQUIPE", "ALPINA")
        ));

        assertEquals(0, summary.inserted());
        assertEquals(4, summary.rejected());
        assertEquals(List.of(2, 3, 4, 5), summary.rejections().stream().map(RowRejection::rowNumber).toList());
        assertTrue(summary.rejections().get(3).reason().contains("ALPINA"));
        assertEquals(0, store.counts().materials());
    }

    @Test
    void reimportIsANoOp() throws Exception {
        List<MaterialRow> rows = List.of(new MaterialRow(2, "1001", "LECHE", "lactalis"));
        store.importMaterials(rows);

        ImportSummary second = store.importMaterials(rows);

        assertEquals(0, second.inserted());
        assertEquals(1, second.alreadyExisting());
        assertEquals(1, store.counts().materials());
    }

    @Test
    void duplicateKeyKeepsFirstDescription() throws Exception {
        ImportSummary summary = store.importMaterials(List.of(
            new MaterialRow(2, "1001", "FIRST", "lactalis"),
            new MaterialRow(3, "1001", "SECOND", "parmalat")
        ));

        assertEquals(1, summary.inserted());
        assertEquals(1, summary.alreadyExisting());
    }

    @Test
    void clientNitSentinelsSkipOrBlankTheTaxId() throws Exception {
        ImportSummary summary = store.importClients(List.of(
            new ClientRow(2, "C1", "TIENDA UNO", "900123456"),
            new ClientRow(3, "C2", "TIENDA DOS", "No NIT"),
            new ClientRow(4, "C3", "TIENDA TRES", "sin nit"),
            new ClientRow(5, "C4", "TIENDA CUATRO", "NONIT"),
            new ClientRow(6, "C5", "TIENDA CINCO", "NIT"),
            new ClientRow(7, "C6", "TIENDA SEIS", ""),
            new ClientRow(8, "", "SIN CODIGO", "1"),
            new ClientRow(9, "C7", "", "2")
        ));

        assertEquals(3, summary.inserted());
        assertEquals(3, summary.skipped());
        assertEquals(2, summary.rejected());
        assertEquals(3, store.counts().clients());
        assertTrue(store.lookupClient("900123456"));
        assertFalse(store.lookupClient("NIT"));
        assertFalse(store.lookupClient(""));
    }

    @Test
    void importOrderDoesNotChangeStoredState() throws Exception {
        List<ClientRow> rows = new ArrayList<>(List.of(
            new ClientRow(2, "C1", "A", "100"),
            new ClientRow(3, "C2", "B", "200"),
            new ClientRow(4, "C1", "A", "100")));
        store.importClients(rows);

        try (ReferenceStore other = ReferenceStore.inMemory("ref-" + UUID.randomUUID())) {
            List<ClientRow> reversed = new ArrayList<>(rows);
            Collections.reverse(reversed);
            other.importClients(reversed);

            assertEquals(store.counts(), other.counts());
            assertEquals(store.lookupClient("100"), other.lookupClient("100"));
            assertEquals(store.lookupClient("200"), other.lookupClient("200"));
        }
    }

    @Test
    void readSessionAnswersRepeatedLookups() throws Exception {
        store.importClients(List.of(new ClientRow(2, "C1", "A", "100")));

        try (ReferenceLookup session = store.readSession()) {
            assertTrue(session.lookupClient("100"));
            assertTrue(session.lookupClient("100"));
            assertFalse(session.lookupMaterial("X", "800245795"));
        }
    }

    @Test
    void fileStorePersistsAcrossReopen(@TempDir Path tempDir) throws Exception {
        Path db = tempDir.resolve("db").resolve("reggis-reference");
        try (ReferenceStore file = ReferenceStore.open(db)) {
            file.importMaterials(List.of(new MaterialRow(2, "1001", "LECHE", "lactalis")));
        }
        try (ReferenceStore reopened = ReferenceStore.open(db)) {
            assertEquals(new ReferenceCounts(1, 0), reopened.counts());
            assertTrue(reopened.lookupMaterial("1001", "800245795"));
        }
    }
}
