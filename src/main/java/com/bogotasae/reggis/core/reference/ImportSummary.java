package com.bogotasae.reggis.core.reference;

import java.util.List;

/**
 * Result of one bulk import.
 *
 * @param inserted        rows that created a new record
 * @param alreadyExisting rows whose key was already stored (no-op)
 * @param skipped         rows deliberately ignored, such as clients marked as having no NIT
 * @param rejections      one entry per rejected row
 */
public record ImportSummary(int inserted, int alreadyExisting, int skipped, List<RowRejection> rejections) {

    public ImportSummary {
        rejections = List.copyOf(rejections);
    }

    public int rejected() {
        return rejections.size();
    }

    public int total() {
        return inserted + alreadyExisting + skipped + rejected();
    }

    @Override
    public String toString() {
        return "inserted=" + inserted + ", existing=" + alreadyExisting
            + ", skipped=" + skipped + ", rejected=" + rejected();
    }
}
