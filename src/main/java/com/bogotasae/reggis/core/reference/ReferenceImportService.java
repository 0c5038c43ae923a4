package com.bogotasae.reggis.core.reference;

import java.io.IOException;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Bulk import entry point: reads a reference workbook and stores its rows.
 * A header mismatch fails the whole call before anything is written.
 */
public final class ReferenceImportService {
    private final ReferenceStore store;
    private final ReferenceWorkbookReader reader;

    public ReferenceImportService(ReferenceStore store) {
        this(store, new ReferenceWorkbookReader());
    }

    public ReferenceImportService(ReferenceStore store, ReferenceWorkbookReader reader) {
        this.store = Objects.requireNonNull(store, "store");
        this.reader = Objects.requireNonNull(reader, "reader");
    }

    public ImportSummary importMaterials(Path workbook) throws IOException, FormatInvalidException, SQLException {
        return store.importMaterials(reader.readMaterials(workbook));
    }

    public ImportSummary importClients(Path workbook) throws IOException, FormatInvalidException, SQLException {
        return store.importClients(reader.readClients(workbook));
    }
}
