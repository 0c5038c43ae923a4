package com.bogotasae.reggis.core.batch;

/**
 * A per-file problem recorded during a run. The run continues past it.
 */
public record FileError(String source, ErrorKind kind, String message) {

    @Override
    public String toString() {
        return kind + " " + source + ": " + message;
    }
}
