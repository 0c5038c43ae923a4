package com.bogotasae.reggis.core.batch;

public enum BatchState {
    IDLE,
    SCANNING,
    EXTRACTING,
    VALIDATING,
    WRITING,
    DONE,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == CANCELLED;
    }
}
