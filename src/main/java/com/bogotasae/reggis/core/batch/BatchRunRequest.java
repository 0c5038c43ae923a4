package com.bogotasae.reggis.core.batch;

import com.bogotasae.reggis.core.export.ExportMode;

import java.nio.file.Path;
import java.util.Objects;

/**
 * @param outputFolder where the workbook and report go; {@code null} means {@code <inputFolder>/REGGIS}
 * @param mode         sales or purchases; {@code null} means {@link ExportMode#SALES}
 */
public record BatchRunRequest(Path inputFolder,
                              Path outputFolder,
                              boolean validateMaterials,
                              boolean validateClients,
                              ExportMode mode) {

    public static final String DEFAULT_OUTPUT_FOLDER = "REGGIS";

    public BatchRunRequest {
        Objects.requireNonNull(inputFolder, "inputFolder");
        mode = mode == null ? ExportMode.SALES : mode;
    }

    public BatchRunRequest(Path inputFolder, Path outputFolder, boolean validateMaterials, boolean validateClients) {
        this(inputFolder, outputFolder, validateMaterials, validateClients, ExportMode.SALES);
    }

    public Path effectiveOutputFolder() {
        return outputFolder != null ? outputFolder : inputFolder.resolve(DEFAULT_OUTPUT_FOLDER);
    }

    public boolean validationEnabled() {
        return validateMaterials || validateClients;
    }
}
