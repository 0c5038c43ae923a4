package com.bogotasae.reggis.core.export;

import java.nio.file.Path;

/**
 * Raised when the output folder, the workbook or the run report cannot be written. Fatal to the run.
 */
public final class OutputUnwritableException extends Exception {
    private final Path target;

    public OutputUnwritableException(Path target, String message, Throwable cause) {
        super(message + ": " + target, cause);
        this.target = target;
    }

    public Path getTarget() {
        return target;
    }
}
