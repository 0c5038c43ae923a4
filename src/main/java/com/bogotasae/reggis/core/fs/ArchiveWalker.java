package com.bogotasae.reggis.core.fs;

import com.bogotasae.reggis.logging.AppLogger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Enumeration;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;

/**
 * Enumerates the invoice inputs of a folder and streams the XML documents they contain.
 * <p>
 * Only the top level of the folder is scanned. Zip containers are read entry by entry, in archive order,
 * so one document is held in memory at a time.
 */
public final class ArchiveWalker {
    private static final Logger LOGGER = AppLogger.get();
    private static final Charset LEGACY_ZIP_CHARSET = Charset.forName("Cp437");

    public interface Listener {
        default void onEntrySkipped(InputUnit unit, String entryName, String reason) {
        }

        default void onEntryUnreadable(InputUnit unit, String entryName, IOException cause) {
        }
    }

    @FunctionalInterface
    public interface DocumentVisitor {
        /**
         * @return {@code false} to stop reading the remaining documents of the unit
         */
        boolean visit(InvoiceDocument document);
    }

    private static final Listener NO_OP = new Listener() {
    };

    /**
     * Lists loose {@code .xml} files and {@code .zip} containers directly under {@code folder}, ordered by name.
     */
    public List<InputUnit> enumerate(Path folder) throws IOException {
        if (folder == null || !Files.isDirectory(folder)) {
            throw new IOException("Input folder not found: " + folder);
        }
        List<Path> candidates;
        try (Stream<Path> stream = Files.list(folder)) {
            candidates = stream
                .filter(Files::isRegularFile)
                .filter(p -> kindOf(p) != null)
                .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                .toList();
        }
        List<InputUnit> units = new ArrayList<>(candidates.size());
        for (Path candidate : candidates) {
            units.add(new InputUnit(units.size(), candidate, kindOf(candidate)));
        }
        LOGGER.fine(() -> "Found " + units.size() + " input file(s) in " + folder);
        return units;
    }

    /**
     * Feeds every XML document of {@code unit} to {@code visitor}.
     *
     * @throws ArchiveUnreadableException when a zip container cannot be opened or listed
     * @throws IOException                when a loose XML file cannot be read
     */
    public void readDocuments(InputUnit unit, DocumentVisitor visitor, Listener listener)
        throws ArchiveUnreadableException, IOException {
        Listener events = listener == null ? NO_OP : listener;
        if (!unit.isArchive()) {
            visitor.visit(new InvoiceDocument(unit.name(), Files.readAllBytes(unit.path())));
            return;
        }
        try (ZipFile zip = openArchive(unit)) {
            readArchive(unit, zip, visitor, events);
        } catch (IOException e) {
            throw new ArchiveUnreadableException(unit.name(), "cannot read archive (" + e.getMessage() + ")", e);
        }
    }

    /**
     * Opens {@code unit} with UTF-8 entry names, falling back to Cp437 for archives written without the UTF-8
     * flag by older Windows tools. JDK 17 rejects such names with a {@link ZipException} when the central
     * directory is read.
     */
    private static ZipFile openArchive(InputUnit unit) throws ArchiveUnreadableException {
        try {
            return openListed(unit, StandardCharsets.UTF_8);
        } catch (ZipException | IllegalArgumentException utf8Failure) {
            LOGGER.fine(() -> unit.name() + ": retrying with legacy entry name encoding (" + utf8Failure.getMessage() + ")");
            try {
                return openListed(unit, LEGACY_ZIP_CHARSET);
            } catch (IOException | IllegalArgumentException e) {
                e.addSuppressed(utf8Failure);
                throw new ArchiveUnreadableException(unit.name(), "cannot open archive (" + e.getMessage() + ")", e);
            }
        } catch (IOException e) {
            throw new ArchiveUnreadableException(unit.name(), "cannot open archive (" + e.getMessage() + ")", e);
        }
    }

    // every entry name is decoded here, so an encoding failure surfaces before any document is visited
    private static ZipFile openListed(InputUnit unit, Charset charset) throws IOException {
        ZipFile zip = new ZipFile(unit.path().toFile(), charset);
        try {
            Enumeration<? extends ZipEntry> entries = zip.entries();
            while (entries.hasMoreElements()) {
                entries.nextElement();
            }
            return zip;
        } catch (RuntimeException e) {
            zip.close();
            throw e;
        }
    }

    private void readArchive(InputUnit unit, ZipFile zip, DocumentVisitor visitor, Listener listener) {
        List<? extends ZipEntry> entries = Collections.list(zip.entries());
        for (ZipEntry entry : entries) {
            String name = entry.getName();
            if (entry.isDirectory() || name.startsWith("__MACOSX/") || isAppleDouble(name)) {
                continue;
            }
            String lower = name.toLowerCase(Locale.ROOT);
            if (lower.endsWith(".zip")) {
                listener.onEntrySkipped(unit, name, "Nested archives are not read");
                continue;
            }
            if (!lower.endsWith(".xml")) {
                LOGGER.finest(() -> unit.name() + ": ignoring " + name);
                continue;
            }
            byte[] content;
            try (InputStream in = zip.getInputStream(entry)) {
                content = in.readAllBytes();
            } catch (IOException e) {
                listener.onEntryUnreadable(unit, name, e);
                continue;
            }
            if (!visitor.visit(new InvoiceDocument(unit.name() + "/" + name, content))) {
                return;
            }
        }
    }

    private static boolean isAppleDouble(String entryName) {
        int slash = entryName.lastIndexOf('/');
        return entryName.substring(slash + 1).startsWith("._");
    }

    private static InputUnit.Kind kindOf(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".xml")) {
            return InputUnit.Kind.XML;
        }
        if (name.endsWith(".zip")) {
            return InputUnit.Kind.ZIP;
        }
        return null;
    }
}
