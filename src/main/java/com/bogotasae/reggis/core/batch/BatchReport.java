package com.bogotasae.reggis.core.batch;

import com.bogotasae.reggis.core.export.ExportMode;
import com.bogotasae.reggis.core.model.DocumentType;
import com.bogotasae.reggis.core.validate.Rejection;
import com.bogotasae.reggis.core.validate.RejectionReason;
import org.json.JSONArray;
import org.json.JSONObject;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one batch run. Returned for every run, including failed and cancelled ones.
 *
 * @param message            failure or cancellation reason, empty when the run succeeded
 * @param mode               sales or purchases, as requested
 * @param documentsByType    every document read, by UBL document type
 * @param invalidLines       lines dropped because of a non-positive quantity or price
 * @param unnormalizedLines  exported lines whose unit or currency was passed through unconverted
 * @param outputFile         written workbook, {@code null} unless the state is {@link BatchState#DONE}
 * @param reportFile         written JSON report, {@code null} unless the state is {@link BatchState#DONE}
 */
public record BatchReport(BatchState state,
                          String message,
                          Path inputFolder,
                          ExportMode mode,
                          int unitsFound,
                          int documentsProcessed,
                          Map<DocumentType, Integer> documentsByType,
                          long linesExtracted,
                          long invalidLines,
                          long unnormalizedLines,
                          long accepted,
                          Map<RejectionReason, Integer> rejectedByReason,
                          List<Rejection> rejections,
                          List<FileError> errors,
                          List<String> notices,
                          Path outputFile,
                          Path reportFile) {

    public BatchReport {
        message = message == null ? "" : message;
        documentsByType = Collections.unmodifiableMap(copyOf(documentsByType, DocumentType.class));
        rejectedByReason = Collections.unmodifiableMap(copyOf(rejectedByReason, RejectionReason.class));
        rejections = List.copyOf(rejections);
        errors = List.copyOf(errors);
        notices = List.copyOf(notices);
    }

    private static <K extends Enum<K>> EnumMap<K, Integer> copyOf(Map<K, Integer> source, Class<K> type) {
        EnumMap<K, Integer> copy = new EnumMap<>(type);
        if (source != null) {
            copy.putAll(source);
        }
        return copy;
    }

    public long rejected() {
        return rejections.size();
    }

    public int rejectedBy(RejectionReason reason) {
        return rejectedByReason.getOrDefault(reason, 0);
    }

    public int documentsOf(DocumentType type) {
        return documentsByType.getOrDefault(type, 0);
    }

    public boolean succeeded() {
        return state == BatchState.DONE;
    }

    BatchReport withOutput(Path workbook, Path report) {
        return new BatchReport(state, message, inputFolder, mode, unitsFound, documentsProcessed, documentsByType,
            linesExtracted, invalidLines, unnormalizedLines, accepted, rejectedByReason, rejections, errors,
            notices, workbook, report);
    }

    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("state", state.name());
        json.put("message", message);
        json.put("inputFolder", inputFolder == null ? JSONObject.NULL : inputFolder.toString());
        json.put("mode", mode == null ? JSONObject.NULL : mode.name());
        json.put("unitsFound", unitsFound);
        json.put("documentsProcessed", documentsProcessed);
        JSONObject byType = new JSONObject();
        documentsByType.forEach((type, count) -> byType.put(type.name(), count));
        json.put("documentsByType", byType);
        json.put("linesExtracted", linesExtracted);
        json.put("invalidLines", invalidLines);
        json.put("unnormalizedLines", unnormalizedLines);
        json.put("accepted", accepted);
        json.put("rejected", rejected());
        JSONObject byReason = new JSONObject();
        rejectedByReason.forEach((reason, count) -> byReason.put(reason.name(), count));
        json.put("rejectedByReason", byReason);

        JSONArray rejectionArray = new JSONArray();
        for (Rejection rejection : rejections) {
            rejectionArray.put(new JSONObject()
                .put("source", rejection.sourceName())
                .put("invoice", rejection.invoiceNumber())
                .put("reason", rejection.reason().name())
                .put("identifier", rejection.identifier()));
        }
        json.put("rejections", rejectionArray);

        JSONArray errorArray = new JSONArray();
        for (FileError error : errors) {
            errorArray.put(new JSONObject()
                .put("source", error.source())
                .put("kind", error.kind().name())
                .put("message", error.message()));
        }
        json.put("errors", errorArray);
        json.put("notices", new JSONArray(notices));
        json.put("outputFile", outputFile == null ? JSONObject.NULL : outputFile.getFileName().toString());
        return json;
    }

    @Override
    public String toString() {
        return state + ": units=" + unitsFound + ", documents=" + documentsProcessed
            + ", lines=" + linesExtracted + ", invalid=" + invalidLines
            + ", accepted=" + accepted + ", rejected=" + rejected()
            + ", errors=" + errors.size()
            + (message.isEmpty() ? "" : " (" + message + ")");
    }
}
