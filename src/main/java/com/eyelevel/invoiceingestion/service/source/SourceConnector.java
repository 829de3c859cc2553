package com.eyelevel.invoiceingestion.service.source;

import com.eyelevel.invoiceingestion.model.SourceKind;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Defines the contract for accessing one kind of drop folder (local directory, FTP or SFTP tree).
 * <p>
 * Paths are source-native strings using {@code /} as separator. Implementations must never overwrite an
 * existing file on {@link #move(String, String)}; they raise {@link java.nio.file.FileAlreadyExistsException}
 * instead, so callers can pick a collision-free name.
 */
public interface SourceConnector {

    /**
     * Determines if this connector serves the given source kind.
     */
    boolean supports(SourceKind kind);

    /**
     * Lists the regular files directly inside {@code folder}, in the order the source returns them.
     * A missing folder yields an empty list.
     */
    List<CandidateFile> list(String folder) throws IOException;

    /**
     * Copies the source file to a local path, replacing any partial file left there.
     */
    void download(String sourcePath, Path localTarget) throws IOException;

    void move(String from, String to) throws IOException;

    void makeDirectories(String folder) throws IOException;

    boolean exists(String path) throws IOException;

    void writeText(String path, String content) throws IOException;

    void delete(String path) throws IOException;
}
