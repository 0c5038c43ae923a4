package com.bogotasae.reggis.core.batch;

public enum ErrorKind {
    MALFORMED_DOCUMENT,
    ARCHIVE_UNREADABLE,
    FILE_UNREADABLE,
    UNEXPECTED
}
