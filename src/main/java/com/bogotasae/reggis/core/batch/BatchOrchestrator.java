package com.bogotasae.reggis.core.batch;

import com.bogotasae.reggis.config.ConfigService;
import com.bogotasae.reggis.core.export.ExportMode;
import com.bogotasae.reggis.core.export.OutputUnwritableException;
import com.bogotasae.reggis.core.export.ReggisWorkbookWriter;
import com.bogotasae.reggis.core.export.RunReportWriter;
import com.bogotasae.reggis.core.fs.ArchiveUnreadableException;
import com.bogotasae.reggis.core.fs.ArchiveWalker;
import com.bogotasae.reggis.core.fs.InputUnit;
import com.bogotasae.reggis.core.fs.InvoiceDocument;
import com.bogotasae.reggis.core.model.DocumentType;
import com.bogotasae.reggis.core.model.InvoiceLine;
import com.bogotasae.reggis.core.normalize.BrandEntityTable;
import com.bogotasae.reggis.core.normalize.UnitCurrencyNormalizer;
import com.bogotasae.reggis.core.reference.ReferenceLookup;
import com.bogotasae.reggis.core.reference.ReferenceStore;
import com.bogotasae.reggis.core.validate.Rejection;
import com.bogotasae.reggis.core.validate.RejectionReason;
import com.bogotasae.reggis.core.validate.ValidationFilter;
import com.bogotasae.reggis.core.xml.ExtractedDocument;
import com.bogotasae.reggis.core.xml.InvoiceExtractor;
import com.bogotasae.reggis.core.xml.MalformedDocumentException;
import com.bogotasae.reggis.logging.AppLogger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs one export: scan the input folder, extract lines on a bounded worker pool, validate them against the
 * reference data and write the REGGIS workbook plus its JSON report.
 * <p>
 * Input units are processed in parallel but their results are kept per unit index and concatenated in
 * enumeration order, so the output does not depend on scheduling. Problems with individual files are recorded
 * in the report; the run fails only when the input folder is missing, no line is accepted, or the output cannot
 * be written.
 */
public final class BatchOrchestrator {
    private static final Logger LOGGER = AppLogger.get();

    private final InvoiceExtractor extractor;
    private final ArchiveWalker walker;
    private final ReferenceStore referenceStore;
    private final ReggisWorkbookWriter workbookWriter;
    private final RunReportWriter reportWriter;
    private final int workers;
    private final int progressEveryLines;
    private final Clock clock;

    private volatile BatchState state = BatchState.IDLE;

    /**
     * @param referenceStore may be {@code null} when runs never validate
     */
    public BatchOrchestrator(InvoiceExtractor extractor,
                             ArchiveWalker walker,
                             ReferenceStore referenceStore,
                             ReggisWorkbookWriter workbookWriter,
                             RunReportWriter reportWriter,
                             int workers,
                             int progressEveryLines,
                             Clock clock) {
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.walker = Objects.requireNonNull(walker, "walker");
        this.referenceStore = referenceStore;
        this.workbookWriter = Objects.requireNonNull(workbookWriter, "workbookWriter");
        this.reportWriter = Objects.requireNonNull(reportWriter, "reportWriter");
        this.workers = Math.max(1, workers);
        this.progressEveryLines = Math.max(1, progressEveryLines);
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public static BatchOrchestrator fromConfig(ConfigService config, ReferenceStore referenceStore) {
        InvoiceExtractor extractor = new InvoiceExtractor(
            UnitCurrencyNormalizer.fromConfig(config), BrandEntityTable.defaults());
        return new BatchOrchestrator(extractor, new ArchiveWalker(), referenceStore,
            new ReggisWorkbookWriter(), new RunReportWriter(),
            config.getWorkerThreads(), config.getProgressEveryLines(), Clock.systemDefaultZone());
    }

    public BatchState state() {
        return state;
    }

    public BatchReport run(BatchRunRequest request, BatchProgressListener listener, BooleanSupplier cancelRequested) {
        Objects.requireNonNull(request, "request");
        BatchProgressListener events = new SafeListener(listener == null ? BatchProgressListener.NONE : listener);
        BooleanSupplier cancelled = cancelRequested == null ? () -> false : cancelRequested;
        RunTally tally = new RunTally(request.inputFolder(), request.mode());

        BatchReport report = execute(request, events, cancelled, tally);
        transition(report.state(), events);
        if (report.succeeded()) {
            LOGGER.info(() -> "Run finished: " + report);
        } else {
            LOGGER.warning(() -> "Run ended: " + report);
        }
        events.onFinished(report);
        return report;
    }

    private BatchReport execute(BatchRunRequest request,
                                BatchProgressListener events,
                                BooleanSupplier cancelled,
                                RunTally tally) {
        transition(BatchState.SCANNING, events);
        if (request.validationEnabled() && referenceStore == null) {
            return tally.toReport(BatchState.FAILED, "Validation requested but no reference database is available");
        }
        List<InputUnit> units;
        try {
            units = walker.enumerate(request.inputFolder());
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Cannot scan input folder " + request.inputFolder(), e);
            return tally.toReport(BatchState.FAILED, e.getMessage());
        }
        tally.unitsFound = units.size();
        if (units.isEmpty()) {
            return tally.toReport(BatchState.FAILED, "No .xml or .zip files found in " + request.inputFolder());
        }

        transition(BatchState.EXTRACTING, events);
        UnitResult[] results = extractAll(units, events, cancelled);
        boolean cancelledDuringExtraction = cancelled.getAsBoolean();
        List<InvoiceLine> extracted = tally.merge(units, results, cancelledDuringExtraction);
        if (cancelledDuringExtraction) {
            return tally.toReport(BatchState.CANCELLED, "Cancelled; nothing was written");
        }

        transition(BatchState.VALIDATING, events);
        ValidationFilter.Result filtered;
        try {
            filtered = validate(request, extracted);
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Validation against the reference database failed", e);
            return tally.toReport(BatchState.FAILED, "Validation failed: " + e.getMessage());
        }
        tally.applyValidation(filtered);
        if (filtered.accepted().isEmpty()) {
            return tally.toReport(BatchState.FAILED, "No lines accepted; no workbook written");
        }
        if (cancelled.getAsBoolean()) {
            return tally.toReport(BatchState.CANCELLED, "Cancelled; nothing was written");
        }

        transition(BatchState.WRITING, events);
        return write(request, filtered.accepted(), tally);
    }

    private UnitResult[] extractAll(List<InputUnit> units, BatchProgressListener events, BooleanSupplier cancelled) {
        UnitResult[] results = new UnitResult[units.size()];
        AtomicInteger nextUnit = new AtomicInteger();
        AtomicLong lineCounter = new AtomicLong();
        int poolSize = Math.min(workers, units.size());

        ThreadFactory tf = r -> {
            Thread t = new Thread(r, "ExtractPool-Worker");
            t.setDaemon(true);
            return t;
        };
        ExecutorService pool = Executors.newFixedThreadPool(poolSize, tf);
        List<Future<?>> futures = new ArrayList<>(poolSize);
        try {
            for (int i = 0; i < poolSize; i++) {
                futures.add(pool.submit(() -> {
                    while (!cancelled.getAsBoolean()) {
                        int index = nextUnit.getAndIncrement();
                        if (index >= units.size()) {
                            return;
                        }
                        results[index] = processUnit(units.get(index), units.size(), events, lineCounter);
                    }
                }));
            }
            for (Future<?> future : futures) {
                try {
                    future.get();
                } catch (ExecutionException e) {
                    LOGGER.log(Level.SEVERE, "Extraction worker stopped unexpectedly", e.getCause());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warning("Interrupted while waiting for extraction workers");
        } finally {
            pool.shutdown();
        }
        return results;
    }

    private UnitResult processUnit(InputUnit unit,
                                   int totalUnits,
                                   BatchProgressListener events,
                                   AtomicLong lineCounter) {
        UnitResult result = new UnitResult();
        events.onUnitStarted(unit, totalUnits);
        ArchiveWalker.Listener entryEvents = new ArchiveWalker.Listener() {
            @Override
            public void onEntrySkipped(InputUnit skippedUnit, String entryName, String reason) {
                String notice = skippedUnit.name() + "/" + entryName + ": " + reason;
                result.notices.add(notice);
                LOGGER.info(notice);
            }

            @Override
            public void onEntryUnreadable(InputUnit failedUnit, String entryName, IOException cause) {
                result.errors.add(new FileError(failedUnit.name() + "/" + entryName, ErrorKind.ARCHIVE_UNREADABLE,
                    String.valueOf(cause.getMessage())));
                LOGGER.warning(() -> failedUnit.name() + "/" + entryName + ": unreadable entry (" + cause.getMessage() + ")");
            }
        };
        try {
            walker.readDocuments(unit, document -> {
                handleDocument(document, result);
                int added = result.lastDocumentLines;
                if (added > 0) {
                    long after = lineCounter.addAndGet(added);
                    if ((after - added) / progressEveryLines != after / progressEveryLines) {
                        events.onLinesExtracted(after);
                    }
                }
                return true;
            }, entryEvents);
        } catch (ArchiveUnreadableException e) {
            fail(unit, result, events, new FileError(unit.name(), ErrorKind.ARCHIVE_UNREADABLE, e.getMessage()));
            return result;
        } catch (IOException e) {
            fail(unit, result, events, new FileError(unit.name(), ErrorKind.FILE_UNREADABLE, String.valueOf(e.getMessage())));
            return result;
        } catch (RuntimeException | Error e) {
            LOGGER.log(Level.SEVERE, "Unexpected failure reading " + unit.name(), e);
            fail(unit, result, events, new FileError(unit.name(), ErrorKind.UNEXPECTED, String.valueOf(e)));
            return result;
        }
        events.onUnitCompleted(unit, result.lines.size());
        return result;
    }

    private void handleDocument(InvoiceDocument document, UnitResult result) {
        result.lastDocumentLines = 0;
        try {
            ExtractedDocument extracted = extractor.extract(document.sourceName(), document.content());
            result.documents++;
            result.documentsByType.merge(extracted.type(), 1, Integer::sum);
            result.lines.addAll(extracted.lines());
            result.invalidLines += extracted.invalidLines().size();
            result.lastDocumentLines = extracted.lines().size();
            extracted.invalidLines().forEach(note -> LOGGER.fine(() -> "Invalid line dropped, " + note));
        } catch (MalformedDocumentException e) {
            result.documents++;
            result.errors.add(new FileError(document.sourceName(), ErrorKind.MALFORMED_DOCUMENT, e.getMessage()));
            LOGGER.warning(e.getMessage());
        } catch (RuntimeException e) {
            result.documents++;
            result.errors.add(new FileError(document.sourceName(), ErrorKind.UNEXPECTED, String.valueOf(e)));
            LOGGER.log(Level.WARNING, "Unexpected failure extracting " + document.sourceName(), e);
        }
    }

    private static void fail(InputUnit unit, UnitResult result, BatchProgressListener events, FileError error) {
        result.errors.add(error);
        LOGGER.warning(error::toString);
        events.onUnitFailed(unit, error);
    }

    private ValidationFilter.Result validate(BatchRunRequest request, List<InvoiceLine> lines) {
        if (!request.validationEnabled()) {
            return ValidationFilter.passThrough().apply(lines);
        }
        try (ReferenceLookup session = referenceStore.readSession()) {
            ValidationFilter filter = new ValidationFilter(session,
                request.validateMaterials(), request.validateClients());
            return filter.apply(lines);
        }
    }

    private BatchReport write(BatchRunRequest request, List<InvoiceLine> accepted, RunTally tally) {
        LocalDateTime now = LocalDateTime.now(clock);
        Path outputFolder = request.effectiveOutputFolder();
        Path target = null;
        try {
            Files.createDirectories(outputFolder);
            target = ReggisWorkbookWriter.resolveTarget(outputFolder, folderName(request.inputFolder()), now);
            workbookWriter.write(target, accepted, request.mode());
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Cannot create output folder " + outputFolder, e);
            return tally.toReport(BatchState.FAILED, "Cannot create output folder " + outputFolder);
        } catch (OutputUnwritableException e) {
            LOGGER.log(Level.SEVERE, e.getMessage(), e.getCause());
            return tally.toReport(BatchState.FAILED, e.getMessage());
        }

        BatchReport done = tally.toReport(BatchState.DONE, "")
            .withOutput(target, RunReportWriter.reportPathFor(target));
        try {
            reportWriter.write(target, done.toJson());
        } catch (OutputUnwritableException e) {
            LOGGER.log(Level.SEVERE, e.getMessage(), e.getCause());
            discard(target);
            return tally.toReport(BatchState.FAILED, e.getMessage());
        }
        return done;
    }

    private static void discard(Path workbook) {
        try {
            Files.deleteIfExists(workbook);
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Could not remove incomplete output " + workbook, e);
        }
    }

    private static String folderName(Path folder) {
        Path absolute = folder.toAbsolutePath().normalize();
        Path name = absolute.getFileName();
        return name == null ? "input" : name.toString();
    }

    private void transition(BatchState next, BatchProgressListener events) {
        BatchState previous = state;
        if (previous == next) {
            return;
        }
        state = next;
        LOGGER.fine(() -> "State " + previous + " -> " + next);
        events.onStateChanged(next);
    }

    private static final class UnitResult {
        final List<InvoiceLine> lines = new ArrayList<>();
        final List<FileError> errors = new ArrayList<>();
        final List<String> notices = new ArrayList<>();
        final Map<DocumentType, Integer> documentsByType = new EnumMap<>(DocumentType.class);
        int documents;
        long invalidLines;
        int lastDocumentLines;
    }

    private static final class RunTally {
        final Path inputFolder;
        final ExportMode mode;
        int unitsFound;
        int documents;
        final Map<DocumentType, Integer> documentsByType = new EnumMap<>(DocumentType.class);
        long linesExtracted;
        long invalidLines;
        long unnormalizedLines;
        long accepted;
        final Map<RejectionReason, Integer> rejectedByReason = new EnumMap<>(RejectionReason.class);
        final List<Rejection> rejections = new ArrayList<>();
        final List<FileError> errors = new ArrayList<>();
        final List<String> notices = new ArrayList<>();

        RunTally(Path inputFolder, ExportMode mode) {
            this.inputFolder = inputFolder;
            this.mode = mode;
        }

        /**
         * Concatenates unit results in enumeration order. A unit left without a result is reported as an
         * error unless the run was cancelled, in which case units were skipped on purpose.
         */
        List<InvoiceLine> merge(List<InputUnit> units, UnitResult[] results, boolean cancelled) {
            List<InvoiceLine> lines = new ArrayList<>();
            for (int i = 0; i < results.length; i++) {
                UnitResult result = results[i];
                if (result == null) {
                    if (!cancelled) {
                        errors.add(new FileError(units.get(i).name(), ErrorKind.UNEXPECTED,
                            "Input was not processed; its extraction worker stopped"));
                    }
                    continue;
                }
                documents += result.documents;
                result.documentsByType.forEach((type, count) -> documentsByType.merge(type, count, Integer::sum));
                invalidLines += result.invalidLines;
                errors.addAll(result.errors);
                notices.addAll(result.notices);
                lines.addAll(result.lines);
            }
            linesExtracted = lines.size();
            return lines;
        }

        void applyValidation(ValidationFilter.Result result) {
            accepted = result.accepted().size();
            unnormalizedLines = result.accepted().stream().filter(line -> !line.normalized()).count();
            rejections.addAll(result.rejections());
            for (Rejection rejection : result.rejections()) {
                rejectedByReason.merge(rejection.reason(), 1, Integer::sum);
            }
        }

        BatchReport toReport(BatchState state, String message) {
            return new BatchReport(state, message, inputFolder, mode, unitsFound, documents, documentsByType,
                linesExtracted, invalidLines, unnormalizedLines, accepted, rejectedByReason, rejections,
                errors, notices, null, null);
        }
    }

    private static final class SafeListener implements BatchProgressListener {
        private final BatchProgressListener delegate;

        SafeListener(BatchProgressListener delegate) {
            this.delegate = delegate;
        }

        @Override
        public void onStateChanged(BatchState state) {
            guard("onStateChanged", () -> delegate.onStateChanged(state));
        }

        @Override
        public void onUnitStarted(InputUnit unit, int totalUnits) {
            guard("onUnitStarted", () -> delegate.onUnitStarted(unit, totalUnits));
        }

        @Override
        public void onUnitCompleted(InputUnit unit, int linesExtracted) {
            guard("onUnitCompleted", () -> delegate.onUnitCompleted(unit, linesExtracted));
        }

        @Override
        public void onUnitFailed(InputUnit unit, FileError error) {
            guard("onUnitFailed", () -> delegate.onUnitFailed(unit, error));
        }

        @Override
        public void onLinesExtracted(long totalLines) {
            guard("onLinesExtracted", () -> delegate.onLinesExtracted(totalLines));
        }

        @Override
        public void onFinished(BatchReport report) {
            guard("onFinished", () -> delegate.onFinished(report));
        }

        private static void guard(String event, Runnable call) {
            try {
                call.run();
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Progress listener failed in " + event, e);
            }
        }
    }
}
