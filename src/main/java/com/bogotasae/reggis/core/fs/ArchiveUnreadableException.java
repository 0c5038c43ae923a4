package com.bogotasae.reggis.core.fs;

/**
 * Raised when a zip container cannot be opened or listed. The batch skips its contents and continues.
 */
public final class ArchiveUnreadableException extends Exception {
    private final String archiveName;

    public ArchiveUnreadableException(String archiveName, String message, Throwable cause) {
        super(archiveName + ": " + message, cause);
        this.archiveName = archiveName;
    }

    public String getArchiveName() {
        return archiveName;
    }
}
