package com.bogotasae.reggis.core.export;

import com.bogotasae.reggis.core.model.InvoiceLine;
import com.bogotasae.reggis.core.normalize.UnitCurrencyNormalizer;
import com.bogotasae.reggis.logging.AppLogger;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.HorizontalAlignment;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.VerticalAlignment;
import org.apache.poi.xssf.streaming.SXSSFWorkbook;
import org.apache.poi.xssf.usermodel.XSSFCellStyle;
import org.apache.poi.xssf.usermodel.XSSFColor;
import org.apache.poi.xssf.usermodel.XSSFFont;

import java.io.IOException;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes the fixed 24-column REGGIS workbook.
 * <p>
 * Every value is a text cell. Numbers carry exactly five decimals with a comma separator and no grouping,
 * whatever the host locale. Files are written to a temporary name and moved into place; an existing file is
 * never overwritten.
 */
public final class ReggisWorkbookWriter {
    private static final Logger LOGGER = AppLogger.get();

    public static final String SHEET_NAME = "REGGIS";
    public static final String FILE_PREFIX = "REGGIS_";
    public static final String EXTENSION = ".xlsx";
    public static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    public static final List<String> HEADERS = List.of(
        "N° Factura",
        "Nombre Producto",
        "Codigo Subyacente",
        "Unidad Medida en Kg,Un,Lt",
        "Cantidad (5 decimales - separdor coma)",
        "Precio Unitario (5 decimales - separdor coma)",
        "Fecha Factura Año-Mes-Dia",
        "Fecha Pago Año-Mes-Dia",
        "Nit Comprador (Existente)",
        "Nombre Comprador",
        "Nit Vendedor (Existente)",
        "Nombre Vendedor",
        "Principal V,C",
        "Municipio (Nombre Exacto de la Ciudad)",
        "Iva (N°%)",
        "Descripción",
        "Activa Factura",
        "Activa Bodega",
        "Incentivo",
        "Cantidad Original (5 decimales - separdor coma)",
        "Moneda (1,2,3)",
        "Total Sin IVA",
        "Total IVA",
        "Total Con IVA"
    );

    // fixed so that re-running an export over the same input produces identical bytes
    private static final Date CREATED = Date.from(Instant.parse("2000-01-01T00:00:00Z"));

    private static final byte[] HEADER_FILL_RGB = {(byte) 0x36, (byte) 0x60, (byte) 0x92};
    private static final int ROW_WINDOW = 200;

    /**
     * Picks a file name in {@code outputFolder} that does not exist yet:
     * {@code REGGIS_<inputFolderName>_<yyyyMMdd_HHmmss>.xlsx}, then {@code ..._1.xlsx}, {@code ..._2.xlsx}...
     * A name whose run report already exists is skipped as well.
     */
    public static Path resolveTarget(Path outputFolder, String inputFolderName, LocalDateTime timestamp) {
        String base = FILE_PREFIX + sanitize(inputFolderName) + "_" + TIMESTAMP.format(timestamp);
        Path candidate = outputFolder.resolve(base + EXTENSION);
        int suffix = 1;
        while (Files.exists(candidate) || Files.exists(RunReportWriter.reportPathFor(candidate))) {
            candidate = outputFolder.resolve(base + "_" + suffix++ + EXTENSION);
        }
        return candidate;
    }

    /**
     * Writes {@code lines} in the given order to a new workbook at {@code target}. The bytes depend only on
     * {@code lines} and {@code mode}.
     */
    public void write(Path target, List<InvoiceLine> lines, ExportMode mode) throws OutputUnwritableException {
        Path folder = target.toAbsolutePath().getParent();
        if (Files.exists(target)) {
            throw new OutputUnwritableException(target, "Refusing to overwrite existing file", null);
        }
        Path temp = null;
        try {
            Files.createDirectories(folder);
            temp = Files.createTempFile(folder, ".reggis-", ".tmp");
            writeWorkbook(temp, lines, mode);
            Files.move(temp, target);
            temp = null;
            LOGGER.info(() -> "Wrote " + lines.size() + " row(s) to " + target);
        } catch (IOException | RuntimeException e) {
            throw new OutputUnwritableException(target, "Cannot write REGGIS workbook", e);
        } finally {
            deleteQuietly(temp);
        }
    }

    private void writeWorkbook(Path file, List<InvoiceLine> lines, ExportMode mode) throws IOException {
        SXSSFWorkbook workbook = new SXSSFWorkbook(ROW_WINDOW);
        try {
            workbook.getXSSFWorkbook().getProperties().getCoreProperties().setCreated(Optional.of(CREATED));
            workbook.getXSSFWorkbook().getProperties().getCoreProperties().setCreator("REGGIS Exporter");

            Sheet sheet = workbook.createSheet(SHEET_NAME);
            writeHeader(sheet, headerStyle(workbook));
            int rowIndex = 1;
            for (InvoiceLine line : lines) {
                writeRow(sheet.createRow(rowIndex++), line, mode);
            }
            try (OutputStream out = Files.newOutputStream(file)) {
                workbook.write(out);
            }
        } finally {
            workbook.dispose();
            workbook.close();
        }
    }

    private static CellStyle headerStyle(SXSSFWorkbook workbook) {
        XSSFCellStyle style = (XSSFCellStyle) workbook.createCellStyle();
        style.setFillForegroundColor(new XSSFColor(HEADER_FILL_RGB, null));
        style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
        style.setAlignment(HorizontalAlignment.CENTER);
        style.setVerticalAlignment(VerticalAlignment.CENTER);
        Font font = workbook.createFont();
        font.setBold(true);
        ((XSSFFont) font).setColor(new XSSFColor(new byte[]{(byte) 0xFF, (byte) 0xFF, (byte) 0xFF}, null));
        style.setFont(font);
        return style;
    }

    private static void writeHeader(Sheet sheet, CellStyle style) {
        Row row = sheet.createRow(0);
        for (int i = 0; i < HEADERS.size(); i++) {
            Cell cell = row.createCell(i, CellType.STRING);
            cell.setCellValue(HEADERS.get(i));
            cell.setCellStyle(style);
        }
    }

    private static void writeRow(Row row, InvoiceLine line, ExportMode mode) {
        List<String> values = toRow(line, mode);
        for (int i = 0; i < values.size(); i++) {
            row.createCell(i, CellType.STRING).setCellValue(values.get(i));
        }
    }

    /**
     * Cell texts of one output row, in header order.
     */
    static List<String> toRow(InvoiceLine line, ExportMode mode) {
        return List.of(
            line.invoiceNumber(),
            line.productName(),
            line.productCode(),
            line.unit(),
            decimal(line.quantity()),
            decimal(line.unitPrice()),
            line.invoiceDate(),
            line.paymentDate(),
            line.buyerTaxId(),
            line.buyerName(),
            line.sellerTaxId(),
            line.sellerName(),
            mode.principal(),
            line.municipality(),
            percent(line.taxPercent()),
            line.productName(),
            mode.activeFlag(),
            mode.activeFlag(),
            "",
            decimal(line.originalQuantity() == null ? line.quantity() : line.originalQuantity()),
            line.currencyCode(),
            decimal(line.totalWithoutTax()),
            decimal(line.taxAmount()),
            decimal(line.totalWithTax())
        );
    }

    /**
     * {@code 1234.5} becomes {@code "1234,50000"}.
     */
    public static String decimal(BigDecimal value) {
        return value.setScale(UnitCurrencyNormalizer.SCALE, RoundingMode.HALF_UP).toPlainString().replace('.', ',');
    }

    /**
     * {@code 19.00} becomes {@code "19"}, {@code 2.5} becomes {@code "2,5"}.
     */
    public static String percent(BigDecimal value) {
        if (value.signum() == 0) {
            return "0";
        }
        return value.stripTrailingZeros().toPlainString().replace('.', ',');
    }

    private static String sanitize(String name) {
        String cleaned = name == null ? "" : name.trim().replaceAll("[\\\\/:*?\"<>|]", "_");
        return cleaned.isEmpty() ? "input" : cleaned;
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOGGER.log(Level.FINE, "Could not delete temporary file " + file, e);
        }
    }
}
