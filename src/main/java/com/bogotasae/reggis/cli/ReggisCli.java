package com.bogotasae.reggis.cli;

import com.bogotasae.reggis.config.ConfigService;
import com.bogotasae.reggis.core.batch.BatchOrchestrator;
import com.bogotasae.reggis.core.batch.BatchProgressListener;
import com.bogotasae.reggis.core.batch.BatchReport;
import com.bogotasae.reggis.core.batch.BatchRunRequest;
import com.bogotasae.reggis.core.batch.BatchState;
import com.bogotasae.reggis.core.batch.FileError;
import com.bogotasae.reggis.core.export.ExportMode;
import com.bogotasae.reggis.core.fs.InputUnit;
import com.bogotasae.reggis.core.reference.FormatInvalidException;
import com.bogotasae.reggis.core.reference.ImportSummary;
import com.bogotasae.reggis.core.reference.ReferenceCounts;
import com.bogotasae.reggis.core.reference.ReferenceImportService;
import com.bogotasae.reggis.core.reference.ReferenceStore;
import com.bogotasae.reggis.core.reference.RowRejection;
import com.bogotasae.reggis.core.validate.RejectionReason;
import com.bogotasae.reggis.logging.AppLogger;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line front end for reference imports and export runs.
 * <pre>
 *   import-materials &lt;file.xlsx&gt;
 *   import-clients &lt;file.xlsx&gt;
 *   counts
 *   run &lt;inputFolder&gt; [outputFolder] [--validate-materials] [--validate-clients] [--purchases]
 * </pre>
 * Exit codes: 0 success, 1 failure, 2 usage error.
 */
public final class ReggisCli {
    private static final Logger LOGGER = AppLogger.get();

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = """
        Usage:
          import-materials <file.xlsx>
          import-clients <file.xlsx>
          counts
          run <inputFolder> [outputFolder] [--validate-materials] [--validate-clients] [--purchases]
        """;

    private final ConfigService config;
    private final PrintStream out;
    private final PrintStream err;

    ReggisCli(ConfigService config, PrintStream out, PrintStream err) {
        this.config = config;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int code = new ReggisCli(ConfigService.getInstance(), System.out, System.err).execute(args);
        System.exit(code);
    }

    int execute(String[] args) {
        if (args == null || args.length == 0) {
            err.print(USAGE);
            return EXIT_USAGE;
        }
        String command = args[0];
        List<String> rest = List.of(args).subList(1, args.length);
        try {
            return switch (command) {
                case "import-materials" -> importFile(rest, true);
                case "import-clients" -> importFile(rest, false);
                case "counts" -> counts(rest);
                case "run" -> runBatch(rest);
                case "-h", "--help", "help" -> {
                    out.print(USAGE);
                    yield EXIT_OK;
                }
                default -> usage("Unknown command: " + command);
            };
        } catch (IOException | SQLException e) {
            LOGGER.log(Level.SEVERE, "Command '" + command + "' failed", e);
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private int importFile(List<String> args, boolean materials) throws IOException, SQLException {
        if (args.size() != 1) {
            return usage("Expected exactly one workbook path");
        }
        Path workbook = Paths.get(args.get(0));
        try (ReferenceStore store = ReferenceStore.open(config.getReferenceDatabasePath())) {
            ReferenceImportService service = new ReferenceImportService(store);
            ImportSummary summary = materials ? service.importMaterials(workbook) : service.importClients(workbook);
            out.println((materials ? "Materials" : "Clients") + " import: " + summary.total() + " row(s), " + summary);
            for (RowRejection rejection : summary.rejections()) {
                out.println("  rejected " + rejection);
            }
            return EXIT_OK;
        } catch (FormatInvalidException e) {
            err.println("Invalid file: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private int counts(List<String> args) throws IOException, SQLException {
        if (!args.isEmpty()) {
            return usage("'counts' takes no arguments");
        }
        try (ReferenceStore store = ReferenceStore.open(config.getReferenceDatabasePath())) {
            ReferenceCounts counts = store.counts();
            out.println("Materials: " + counts.materials());
            out.println("Clients: " + counts.clients());
            return EXIT_OK;
        }
    }

    private int runBatch(List<String> args) throws IOException, SQLException {
        boolean validateMaterials = false;
        boolean validateClients = false;
        ExportMode mode = ExportMode.SALES;
        List<String> positional = new ArrayList<>();
        for (String arg : args) {
            switch (arg) {
                case "--validate-materials" -> validateMaterials = true;
                case "--validate-clients" -> validateClients = true;
                case "--purchases" -> mode = ExportMode.PURCHASES;
                default -> {
                    if (arg.startsWith("--")) {
                        return usage("Unknown option: " + arg);
                    }
                    positional.add(arg);
                }
            }
        }
        if (positional.isEmpty() || positional.size() > 2) {
            return usage("'run' expects an input folder and an optional output folder");
        }
        Path input = Paths.get(positional.get(0));
        Path output = positional.size() == 2
            ? Paths.get(positional.get(1))
            : config.getLastOutputFolder().orElse(null);
        BatchRunRequest request = new BatchRunRequest(input, output, validateMaterials, validateClients, mode);

        BatchReport report;
        if (request.validationEnabled()) {
            try (ReferenceStore store = ReferenceStore.open(config.getReferenceDatabasePath())) {
                report = BatchOrchestrator.fromConfig(config, store).run(request, new ConsoleProgress(), () -> false);
            }
        } else {
            report = BatchOrchestrator.fromConfig(config, null).run(request, new ConsoleProgress(), () -> false);
        }

        printReport(report);
        if (report.state() != BatchState.DONE) {
            return EXIT_FAILURE;
        }
        config.rememberFolders(input, request.effectiveOutputFolder());
        return EXIT_OK;
    }

    private void printReport(BatchReport report) {
        out.println("State: " + report.state() + (report.message().isEmpty() ? "" : " - " + report.message()));
        out.println("Mode: " + report.mode());
        out.println("Input units: " + report.unitsFound() + "; documents: " + report.documentsProcessed());
        report.documentsByType().forEach((type, count) -> out.println("  " + type + ": " + count));
        out.println("Lines extracted: " + report.linesExtracted() + "; invalid lines: " + report.invalidLines());
        out.println("Accepted: " + report.accepted() + "; rejected: " + report.rejected());
        for (RejectionReason reason : RejectionReason.values()) {
            int count = report.rejectedBy(reason);
            if (count > 0) {
                out.println("  " + reason + ": " + count);
            }
        }
        if (report.unnormalizedLines() > 0) {
            out.println("Lines with unconverted unit or currency: " + report.unnormalizedLines());
        }
        for (FileError error : report.errors()) {
            out.println("  error " + error);
        }
        if (report.outputFile() != null) {
            out.println("Output: " + report.outputFile());
        }
    }

    private int usage(String problem) {
        err.println(problem);
        err.print(USAGE);
        return EXIT_USAGE;
    }

    private final class ConsoleProgress implements BatchProgressListener {
        @Override
        public void onUnitFailed(InputUnit unit, FileError error) {
            out.println("  -> FAILED " + unit.name() + ": " + error.message());
        }

        @Override
        public void onUnitCompleted(InputUnit unit, int linesExtracted) {
            out.println("  -> " + unit.name() + ": " + linesExtracted + " line(s)");
        }

        @Override
        public void onLinesExtracted(long totalLines) {
            out.println("  ... " + totalLines + " lines extracted");
        }
    }
}
