package com.bogotasae.reggis.cli;

import com.bogotasae.reggis.config.ConfigService;
import com.bogotasae.reggis.config.PreferencesStore;
import com.bogotasae.reggis.core.xml.UblSamples;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReggisCliTest {

    @TempDir
    Path tempDir;

    private PreferencesStore preferences;
    private ConfigService config;
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private ReggisCli cli;

    @BeforeEach
    void setUp() {
        preferences = PreferencesStore.node("cli-" + UUID.randomUUID());
        config = new ConfigService(preferences);
        config.setReferenceDatabasePath(tempDir.resolve("db").resolve("reference"));
        cli = new ReggisCli(config,
            new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void tearDown() {
        preferences.clear();
    }

    @Test
    void missingOrUnknownCommandIsUsageError() {
        assertEquals(ReggisCli.EXIT_USAGE, cli.execute(new String[0]));
        assertEquals(ReggisCli.EXIT_USAGE, cli.execute(new String[]{"export-everything"}));
        assertEquals(ReggisCli.EXIT_USAGE, cli.execute(new String[]{"run"}));
        assertTrue(err().contains("Usage:"));
    }

    @Test
    void importsMaterialsAndReportsCounts() throws Exception {
        Path workbook = tempDir.resolve("materiales.xlsx");
        writeSheet(workbook, List.of(
            List.of("CODIGO", "DESCRIPCION", "SOCIEDAD"),
            List.of("1001", "LECHE ENTERA", "lactalis"),
            List.of("2002", "QUESO", "proleche"),
            List.of("3003", "YOGURT", "alpina")));

        assertEquals(ReggisCli.EXIT_OK, cli.execute(new String[]{"import-materials", workbook.toString()}));
        assertTrue(out().contains("Materials import: 3 row(s), inserted=2"), out());
        assertTrue(out().contains("row 4: unknown SOCIEDAD 'alpina'"), out());

        assertEquals(ReggisCli.EXIT_OK, cli.execute(new String[]{"counts"}));
        assertTrue(out().contains("Materials: 2"), out());
        assertTrue(out().contains("Clients: 0"), out());
    }

    @Test
    void importOfWrongWorkbookFails() throws Exception {
        Path workbook = tempDir.resolve("clientes.xlsx");
        writeSheet(workbook, List.of(List.of("CODIGO", "DESCRIPCION", "SOCIEDAD")));

        assertEquals(ReggisCli.EXIT_FAILURE, cli.execute(new String[]{"import-clients", workbook.toString()}));
        assertTrue(err().contains("Invalid file"), err());
    }

    @Test
    void runWritesWorkbookAndRemembersFolders() throws Exception {
        Path input = Files.createDirectories(tempDir.resolve("Facturas"));
        Files.write(input.resolve("FV-1.xml"), UblSamples.invoice("FV-1", "800245795", "900123456",
            List.of(UblSamples.line("1001", "LECHE"))));
        Path output = tempDir.resolve("salida");

        int code = cli.execute(new String[]{"run", input.toString(), output.toString()});

        assertEquals(ReggisCli.EXIT_OK, code, err());
        assertTrue(out().contains("State: DONE"), out());
        try (var files = Files.list(output)) {
            assertEquals(2, files.count());
        }
        assertEquals(Optional.of(output.toAbsolutePath()), config.getLastOutputFolder());
    }

    @Test
    void purchasesFlagSelectsBuyerSideExport() throws Exception {
        Path input = Files.createDirectories(tempDir.resolve("Compras"));
        Files.write(input.resolve("FV-9.xml"), UblSamples.invoice("FV-9", "900123456", "800245795",
            List.of(UblSamples.line("1001", "LECHE"))));

        int code = cli.execute(new String[]{"run", input.toString(), tempDir.resolve("salida").toString(), "--purchases"});

        assertEquals(ReggisCli.EXIT_OK, code, err());
        assertTrue(out().contains("Mode: PURCHASES"), out());
        assertEquals(ReggisCli.EXIT_USAGE, cli.execute(new String[]{"run", input.toString(), "--compras"}));
    }

    @Test
    void failedRunExitsWithFailure() {
        int code = cli.execute(new String[]{"run", tempDir.resolve("missing").toString(), tempDir.toString()});

        assertEquals(ReggisCli.EXIT_FAILURE, code);
        assertTrue(out().contains("State: FAILED"), out());
        assertTrue(config.getLastInputFolder().isEmpty());
    }

    private String out() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return err.toString(StandardCharsets.UTF_8);
    }

    private static void writeSheet(Path file, List<List<String>> rows) throws IOException {
        try (Workbook workbook = new XSSFWorkbook();
             OutputStream stream = Files.newOutputStream(file)) {
            Sheet sheet = workbook.createSheet("Hoja1");
            for (int r = 0; r < rows.size(); r++) {
                Row row = sheet.createRow(r);
                for (int c = 0; c < rows.get(r).size(); c++) {
                    row.createCell(c).setCellValue(rows.get(r).get(c));
                }
            }
            workbook.write(stream);
        }
    }
}
