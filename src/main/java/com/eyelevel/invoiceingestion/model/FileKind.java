package com.eyelevel.invoiceingestion.model;

import java.util.Locale;
import java.util.Optional;

public enum FileKind {
    PDF,
    SPREADSHEET;

    /**
     * Maps a file extension (with or without the leading dot) to the kind of document it holds.
     *
     * @return the kind, or empty for unsupported extensions.
     */
    public static Optional<FileKind> fromExtension(String extension) {
        if (extension == null) {
            return Optional.empty();
        }
        String normalized = extension.toLowerCase(Locale.ROOT);
        if (normalized.startsWith(".")) {
            normalized = normalized.substring(1);
        }
        return switch (normalized) {
            case "pdf" -> Optional.of(PDF);
            case "xlsx", "xls" -> Optional.of(SPREADSHEET);
            default -> Optional.empty();
        };
    }
}
