package com.bogotasae.reggis.core.reference;

/**
 * A clients row as read from the import workbook.
 *
 * @param rowNumber 1-based sheet row, used in rejection messages
 */
public record ClientRow(int rowNumber, String parentCode, String name, String nit) {

    public ClientRow {
        parentCode = parentCode == null ? "" : parentCode.trim();
        name = name == null ? "" : name.trim();
        nit = nit == null ? "" : nit.trim();
    }
}
