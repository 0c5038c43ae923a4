package com.bogotasae.reggis.core.export;

import com.bogotasae.reggis.logging.AppLogger;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes the JSON run report next to the workbook it describes.
 */
public final class RunReportWriter {
    private static final Logger LOGGER = AppLogger.get();
    private static final String SUFFIX = "_report.json";

    /**
     * {@code REGGIS_x_20240101_120000.xlsx} maps to {@code REGGIS_x_20240101_120000_report.json}.
     */
    public static Path reportPathFor(Path workbook) {
        String name = workbook.getFileName().toString();
        String base = name.endsWith(ReggisWorkbookWriter.EXTENSION)
            ? name.substring(0, name.length() - ReggisWorkbookWriter.EXTENSION.length())
            : name;
        return workbook.resolveSibling(base + SUFFIX);
    }

    public Path write(Path workbook, JSONObject report) throws OutputUnwritableException {
        Path target = reportPathFor(workbook);
        Path temp = null;
        try {
            temp = Files.createTempFile(target.toAbsolutePath().getParent(), ".reggis-report-", ".tmp");
            Files.writeString(temp, report.toString(2), StandardCharsets.UTF_8);
            Files.move(temp, target);
            temp = null;
            LOGGER.fine(() -> "Run report written to " + target);
            return target;
        } catch (IOException e) {
            throw new OutputUnwritableException(target, "Cannot write run report", e);
        } finally {
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException e) {
                    LOGGER.log(Level.FINE, "Could not delete temporary file " + temp, e);
                }
            }
        }
    }
}
