package com.bogotasae.reggis.core.export;

import com.bogotasae.reggis.core.model.InvoiceLine;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReggisWorkbookWriterTest {

    private static final LocalDateTime RUN_TIME = LocalDateTime.of(2024, 3, 15, 9, 30, 5);

    @TempDir
    Path tempDir;

    private final ReggisWorkbookWriter writer = new ReggisWorkbookWriter();

    @Test
    void writesHeaderAndFormattedRow() throws Exception {
        Path target = ReggisWorkbookWriter.resolveTarget(tempDir, "Facturas Marzo", RUN_TIME);
        assertEquals("REGGIS_Facturas Marzo_20240315_093005.xlsx", target.getFileName().toString());

        writer.write(target, List.of(sampleLine()), ExportMode.SALES);

        List<List<String>> rows = readRows(target);
        assertEquals(ReggisWorkbookWriter.HEADERS, rows.get(0));
        assertEquals(List.of(
            "FV-1001", "LECHE PARMALAT 1L", "1001", "Kg", "1234,50000", "0,33333",
            "2024-03-15", "2024-04-14", "900123456", "TIENDA", "800245795", "LACTALIS",
            "V", "BOGOTÁ, D.C.", "19", "LECHE PARMALAT 1L", "1", "1", "",
            "1234500,00000", "1", "411,49500", "78,18405", "489,67905"), rows.get(1));
        assertEquals(2, rows.size());
    }

    @Test
    void numberFormattingIgnoresHostLocale() {
        Locale previous = Locale.getDefault();
        try {
            Locale.setDefault(Locale.GERMANY);
            assertEquals("1234567,12346", ReggisWorkbookWriter.decimal(new BigDecimal("1234567.123456")));
            Locale.setDefault(Locale.US);
            assertEquals("1234567,12346", ReggisWorkbookWriter.decimal(new BigDecimal("1234567.123456")));
        } finally {
            Locale.setDefault(previous);
        }
        assertEquals("0,00000", ReggisWorkbookWriter.decimal(BigDecimal.ZERO));
        assertEquals("5", ReggisWorkbookWriter.percent(new BigDecimal("5.00")));
        assertEquals("0", ReggisWorkbookWriter.percent(new BigDecimal("0.00")));
        assertEquals("2,5", ReggisWorkbookWriter.percent(new BigDecimal("2.50")));
    }

    @Test
    void neverOverwritesAnExistingOutput() throws Exception {
        Path first = ReggisWorkbookWriter.resolveTarget(tempDir, "in", RUN_TIME);
        writer.write(first, List.of(sampleLine()), ExportMode.SALES);

        Path second = ReggisWorkbookWriter.resolveTarget(tempDir, "in", RUN_TIME);

        assertEquals("REGGIS_in_20240315_093005_1.xlsx", second.getFileName().toString());
        assertThrows(OutputUnwritableException.class, () -> writer.write(first, List.of(sampleLine()), ExportMode.SALES));
    }

    @Test
    void sameLinesGiveSameBytes() throws Exception {
        List<InvoiceLine> lines = List.of(sampleLine(), sampleLine());
        Path a = tempDir.resolve("a.xlsx");
        Path b = tempDir.resolve("b.xlsx");

        writer.write(a, lines, ExportMode.SALES);
        writer.write(b, lines, ExportMode.SALES);

        assertArrayEquals(Files.readAllBytes(a), Files.readAllBytes(b));
    }

    @Test
    void purchasesMarkBuyerSideAndLeaveActivationBlank() throws Exception {
        Path target = tempDir.resolve("compras.xlsx");

        writer.write(target, List.of(sampleLine()), ExportMode.PURCHASES);

        List<String> row = readRows(target).get(1);
        assertEquals("C", row.get(12));
        assertEquals("", row.get(16));
        assertEquals("", row.get(17));
        assertEquals("LECHE PARMALAT 1L", row.get(15));
    }

    @Test
    void exportModeParsesNamesAndPrincipalLetters() {
        assertEquals(Optional.of(ExportMode.PURCHASES), ExportMode.fromText(" c "));
        assertEquals(Optional.of(ExportMode.SALES), ExportMode.fromText("sales"));
        assertTrue(ExportMode.fromText("X").isEmpty());
    }

    @Test
    void leavesNoTemporaryFilesBehind() throws Exception {
        writer.write(tempDir.resolve("out.xlsx"), List.of(sampleLine()), ExportMode.SALES);

        try (Stream<Path> files = Files.list(tempDir)) {
            assertEquals(List.of("out.xlsx"), files.map(p -> p.getFileName().toString()).toList());
        }
    }

    @Test
    void reportSitsNextToWorkbook() throws Exception {
        Path workbook = tempDir.resolve("REGGIS_in_20240315_093005.xlsx");
        Path report = new RunReportWriter().write(workbook, new JSONObject().put("state", "DONE"));

        assertEquals("REGGIS_in_20240315_093005_report.json", report.getFileName().toString());
        assertEquals("DONE", new JSONObject(Files.readString(report)).getString("state"));
        assertFalse(Files.exists(workbook));
        assertTrue(Files.exists(report));
    }

    static InvoiceLine sampleLine() {
        return new InvoiceLine("f.xml", "FV-1001", "LECHE PARMALAT 1L", "1001", "Kg",
            new BigDecimal("1234.50000"), new BigDecimal("0.33333"),
            "2024-03-15", "2024-04-14", "900123456", "TIENDA", "800245795", "LACTALIS", "BOGOTÁ, D.C.",
            new BigDecimal("19.00"), new BigDecimal("1234500.00000"), "1",
            new BigDecimal("411.49500"), new BigDecimal("78.18405"), new BigDecimal("489.67905"),
            "800245795", true);
    }

    static List<List<String>> readRows(Path file) throws IOException {
        List<List<String>> rows = new ArrayList<>();
        try (Workbook workbook = WorkbookFactory.create(file.toFile())) {
            Sheet sheet = workbook.getSheet(ReggisWorkbookWriter.SHEET_NAME);
            for (Row row : sheet) {
                List<String> values = new ArrayList<>();
                for (int c = 0; c < ReggisWorkbookWriter.HEADERS.size(); c++) {
                    Cell cell = row.getCell(c);
                    assertEquals(CellType.STRING, cell.getCellType());
                    values.add(cell.getStringCellValue());
                }
                rows.add(values);
            }
        }
        return rows;
    }
}
