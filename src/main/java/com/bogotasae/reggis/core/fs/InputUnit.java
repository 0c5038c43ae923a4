package com.bogotasae.reggis.core.fs;

import java.nio.file.Path;

/**
 * One top-level item of the input folder: a loose XML file or a zip container.
 *
 * @param index position in enumeration order, used to keep the export order stable
 */
public record InputUnit(int index, Path path, Kind kind) {

    public enum Kind { XML, ZIP }

    public String name() {
        Path fileName = path.getFileName();
        return fileName == null ? path.toString() : fileName.toString();
    }

    public boolean isArchive() {
        return kind == Kind.ZIP;
    }
}
