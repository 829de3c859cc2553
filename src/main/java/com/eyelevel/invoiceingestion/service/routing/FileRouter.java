package com.eyelevel.invoiceingestion.service.routing;

import com.eyelevel.invoiceingestion.service.source.SourceConnector;
import com.eyelevel.invoiceingestion.service.source.SourceLayout;
import com.eyelevel.invoiceingestion.service.source.SourcePaths;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Moves a settled file into its dated terminal folder: {@code processed}, {@code processed/duplicates} or
 * {@code failed}. Existing files are never overwritten; on a name clash a {@code -<epochMillis>} suffix is
 * inserted before the extension. Failed files also get a {@code .error.txt} sidecar.
 */
@Slf4j
@Component
public class FileRouter {

    static final int MAX_RENAME_ATTEMPTS = 5;

    /**
     * @return the path the file now lives at
     */
    public String route(final SourceConnector connector, final SourceLayout layout, final String sourcePath,
                        final TerminalState state, final String errorMessage) throws IOException {
        final String folder = SourcePaths.join(baseFolder(layout, state), LocalDate.now().toString());
        connector.makeDirectories(folder);

        final String fileName = SourcePaths.fileName(sourcePath);
        String target = SourcePaths.join(folder, fileName);
        for (int attempt = 1; ; attempt++) {
            try {
                connector.move(sourcePath, target);
                break;
            } catch (FileAlreadyExistsException e) {
                if (attempt >= MAX_RENAME_ATTEMPTS) {
                    throw e;
                }
                target = SourcePaths.join(folder, withSuffix(fileName, System.currentTimeMillis() + attempt - 1));
                log.debug("'{}' already exists in {}. Retrying as {}.", fileName, folder, target);
            }
        }
        log.info("Routed '{}' to {} ({}).", fileName, target, state);

        if (state == TerminalState.FAILED) {
            writeErrorSidecar(connector, target, errorMessage);
        }
        return target;
    }

    static String baseFolder(final SourceLayout layout, final TerminalState state) {
        return switch (state) {
            case PROCESSED -> layout.processed();
            case DUPLICATE -> layout.duplicates();
            case FAILED -> layout.failed();
        };
    }

    static String withSuffix(final String fileName, final long epochMillis) {
        final int dot = fileName.lastIndexOf('.');
        if (dot <= 0) {
            return fileName + "-" + epochMillis;
        }
        return fileName.substring(0, dot) + "-" + epochMillis + fileName.substring(dot);
    }

    private void writeErrorSidecar(final SourceConnector connector, final String routedPath, final String errorMessage) {
        final String sidecar = routedPath + ".error.txt";
        final String content = "Failed at: " + Instant.now() + "\nError: "
                               + (errorMessage == null ? "Unknown error" : errorMessage) + "\n";
        try {
            connector.writeText(sidecar, content);
        } catch (IOException e) {
            log.error("Failed to write error sidecar {}. The file itself was routed.", sidecar, e);
        }
    }
}
