package com.bogotasae.reggis.core.reference;

/**
 * Read-only view over the reference data. Closing releases whatever the view holds (a read lock for store sessions).
 */
public interface ReferenceLookup extends AutoCloseable {

    boolean lookupMaterial(String code, String entityTaxId);

    boolean lookupClient(String taxId);

    @Override
    void close();
}
