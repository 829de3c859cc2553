package com.eyelevel.invoiceingestion.service.source;

import com.eyelevel.invoiceingestion.model.SourceKind;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * A {@link SourceConnector} for drop folders on the local (or mounted) file system.
 * Manual uploads are staged on the local file system as well, so they share this connector.
 */
@Slf4j
@Component
public class LocalSourceConnector implements SourceConnector {

    @Override
    public boolean supports(final SourceKind kind) {
        return kind == SourceKind.LOCAL || kind == SourceKind.MANUAL_UPLOAD;
    }

    @Override
    public List<CandidateFile> list(final String folder) throws IOException {
        final Path dir = Path.of(folder);
        if (!Files.isDirectory(dir)) {
            log.warn("Local folder {} does not exist. Nothing to list.", dir);
            return List.of();
        }
        final List<CandidateFile> files = new ArrayList<>();
        try (Stream<Path> entries = Files.list(dir)) {
            for (Path entry : entries.sorted(Comparator.comparing(Path::getFileName)).toList()) {
                BasicFileAttributes attributes = Files.readAttributes(entry, BasicFileAttributes.class);
                if (!attributes.isRegularFile()) {
                    continue;
                }
                files.add(new CandidateFile(entry.toString().replace('\\', '/'), entry.getFileName().toString(),
                                            attributes.size(), null, attributes.lastModifiedTime().toInstant()));
            }
        }
        return files;
    }

    @Override
    public void download(final String sourcePath, final Path localTarget) throws IOException {
        Files.createDirectories(localTarget.toAbsolutePath().getParent());
        Files.copy(Path.of(sourcePath), localTarget, StandardCopyOption.REPLACE_EXISTING);
    }

    @Override
    public void move(final String from, final String to) throws IOException {
        final Path target = Path.of(to);
        Files.createDirectories(target.toAbsolutePath().getParent());
        // No REPLACE_EXISTING: an existing target raises FileAlreadyExistsException.
        Files.move(Path.of(from), target);
    }

    @Override
    public void makeDirectories(final String folder) throws IOException {
        Files.createDirectories(Path.of(folder));
    }

    @Override
    public boolean exists(final String path) {
        return Files.exists(Path.of(path));
    }

    @Override
    public void writeText(final String path, final String content) throws IOException {
        FileUtils.writeStringToFile(Path.of(path).toFile(), content, StandardCharsets.UTF_8);
    }

    @Override
    public void delete(final String path) throws IOException {
        Files.deleteIfExists(Path.of(path));
    }
}
