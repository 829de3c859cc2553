package com.eyelevel.invoiceingestion.service.source;

import java.time.Instant;

/**
 * A file discovered in a drop folder during one scan. Exists only for the duration of that scan.
 *
 * @param sourcePath    full path of the file on its source system
 * @param displayName   file name without folders
 * @param sizeBytes     size reported by the source
 * @param contentDigest SHA-256 of the content, {@code null} until hashed
 * @param mtime         last modification time reported by the source
 */
public record CandidateFile(String sourcePath, String displayName, long sizeBytes, String contentDigest,
                            Instant mtime) {

    public CandidateFile withDigest(String digest) {
        return new CandidateFile(sourcePath, displayName, sizeBytes, digest, mtime);
    }

    public String extension() {
        int dot = displayName.lastIndexOf('.');
        return dot < 0 ? "" : displayName.substring(dot + 1);
    }
}
