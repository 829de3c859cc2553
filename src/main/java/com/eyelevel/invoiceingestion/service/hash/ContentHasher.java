package com.eyelevel.invoiceingestion.service.hash;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Computes the content digest (lowercase hex SHA-256) used as the stable identity of a file.
 * Content is streamed, so arbitrarily large files are hashed in constant memory.
 */
@Slf4j
@Component
public class ContentHasher {

    public String digest(final Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            String digest = DigestUtils.sha256Hex(in);
            log.debug("Computed digest {} for {}", digest, file.getFileName());
            return digest;
        }
    }

    public String digest(final InputStream in) throws IOException {
        return DigestUtils.sha256Hex(in);
    }
}
