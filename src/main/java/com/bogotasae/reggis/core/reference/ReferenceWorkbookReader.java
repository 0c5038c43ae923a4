package com.bogotasae.reggis.core.reference;

import com.bogotasae.reggis.logging.AppLogger;
import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Reads the materials and clients import workbooks ({@code .xlsx} or {@code .xls}).
 * <p>
 * The first sheet is used and its first row must carry the expected headers, spelled exactly; column order is free
 * and extra columns are ignored. Cells are read as they are displayed, so a numeric code {@code 123456} stays
 * {@code "123456"}.
 */
public final class ReferenceWorkbookReader {
    private static final Logger LOGGER = AppLogger.get();

    public static final String MATERIAL_CODE = "CODIGO";
    public static final String MATERIAL_DESCRIPTION = "DESCRIPCION";
    public static final String MATERIAL_ENTITY = "SOCIEDAD";
    public static final List<String> MATERIAL_HEADERS = List.of(MATERIAL_CODE, MATERIAL_DESCRIPTION, MATERIAL_ENTITY);

    public static final String CLIENT_PARENT_CODE = "Cód.Padre";
    public static final String CLIENT_NAME = "Nombre Código Padre";
    public static final String CLIENT_NIT = "NIT";
    public static final List<String> CLIENT_HEADERS = List.of(CLIENT_PARENT_CODE, CLIENT_NAME, CLIENT_NIT);

    public List<MaterialRow> readMaterials(Path file) throws IOException, FormatInvalidException {
        List<MaterialRow> rows = new ArrayList<>();
        readSheet(file, MATERIAL_HEADERS, (rowNumber, values) -> rows.add(new MaterialRow(rowNumber,
            values.get(MATERIAL_CODE), values.get(MATERIAL_DESCRIPTION), values.get(MATERIAL_ENTITY))));
        LOGGER.info(() -> "Read " + rows.size() + " material row(s) from " + file.getFileName());
        return rows;
    }

    public List<ClientRow> readClients(Path file) throws IOException, FormatInvalidException {
        List<ClientRow> rows = new ArrayList<>();
        readSheet(file, CLIENT_HEADERS, (rowNumber, values) -> rows.add(new ClientRow(rowNumber,
            values.get(CLIENT_PARENT_CODE), values.get(CLIENT_NAME), values.get(CLIENT_NIT))));
        LOGGER.info(() -> "Read " + rows.size() + " client row(s) from " + file.getFileName());
        return rows;
    }

    @FunctionalInterface
    private interface RowSink {
        void accept(int rowNumber, Map<String, String> values);
    }

    private void readSheet(Path file, List<String> expectedHeaders, RowSink sink)
        throws IOException, FormatInvalidException {
        if (!Files.isRegularFile(file)) {
            throw new NoSuchFileException(file.toString());
        }
        try (Workbook workbook = WorkbookFactory.create(file.toFile(), null, true)) {
            if (workbook.getNumberOfSheets() == 0) {
                throw new FormatInvalidException(file.getFileName() + ": workbook has no sheets");
            }
            Sheet sheet = workbook.getSheetAt(0);
            DataFormatter formatter = new DataFormatter(Locale.ROOT);
            FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();

            Row headerRow = sheet.getRow(sheet.getFirstRowNum());
            if (headerRow == null) {
                throw new FormatInvalidException(file.getFileName() + ": the file is empty");
            }
            Map<String, Integer> columns = mapHeader(headerRow, formatter, evaluator);
            List<String> missing = expectedHeaders.stream().filter(h -> !columns.containsKey(h)).toList();
            if (!missing.isEmpty()) {
                throw new FormatInvalidException(file.getFileName() + ": missing header(s) " + missing
                    + ", expected " + expectedHeaders + " but found " + columns.keySet());
            }

            for (int r = headerRow.getRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                if (row == null) {
                    continue;
                }
                Map<String, String> values = new HashMap<>();
                boolean blank = true;
                for (String header : expectedHeaders) {
                    String value = text(row.getCell(columns.get(header)), formatter, evaluator);
                    values.put(header, value);
                    blank &= value.isEmpty();
                }
                if (!blank) {
                    sink.accept(r + 1, values);
                }
            }
        } catch (EncryptedDocumentException e) {
            throw new FormatInvalidException(file.getFileName() + ": workbook is password protected", e);
        } catch (IOException | RuntimeException e) {
            // POI signals "not a workbook" with IOException/NotOfficeXmlFileException depending on the content
            throw new FormatInvalidException(file.getFileName() + ": not a readable workbook (" + e.getMessage() + ")", e);
        }
    }

    private static Map<String, Integer> mapHeader(Row headerRow, DataFormatter formatter, FormulaEvaluator evaluator) {
        Map<String, Integer> columns = new HashMap<>();
        for (Cell cell : headerRow) {
            String name = text(cell, formatter, evaluator);
            if (!name.isEmpty()) {
                columns.putIfAbsent(name, cell.getColumnIndex());
            }
        }
        return columns;
    }

    private static String text(Cell cell, DataFormatter formatter, FormulaEvaluator evaluator) {
        if (cell == null) {
            return "";
        }
        return formatter.formatCellValue(cell, evaluator).trim();
    }
}
