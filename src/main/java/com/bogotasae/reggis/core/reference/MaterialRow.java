package com.bogotasae.reggis.core.reference;

/**
 * A materials row as read from the import workbook, before the legal entity is resolved.
 *
 * @param rowNumber 1-based sheet row, used in rejection messages
 */
public record MaterialRow(int rowNumber, String code, String description, String entity) {

    public MaterialRow {
        code = code == null ? "" : code.trim();
        description = description == null ? "" : description.trim();
        entity = entity == null ? "" : entity.trim();
    }
}
