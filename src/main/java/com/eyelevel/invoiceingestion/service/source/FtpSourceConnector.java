package com.eyelevel.invoiceingestion.service.source;

import com.eyelevel.invoiceingestion.config.IngestionProperties;
import com.eyelevel.invoiceingestion.model.SourceKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.net.ftp.FTP;
import org.apache.commons.net.ftp.FTPClient;
import org.apache.commons.net.ftp.FTPFile;
import org.apache.commons.net.ftp.FTPReply;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A {@link SourceConnector} for FTP drop folders, built on Apache Commons Net.
 * <p>
 * Every operation opens its own control connection (passive mode, binary transfers) and closes it
 * afterwards. Transient {@link IOException}s are retried with a fixed backoff before they reach the caller.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FtpSourceConnector implements SourceConnector {

    private final IngestionProperties properties;

    @FunctionalInterface
    interface FtpOperation<T> {
        T execute(FTPClient client) throws IOException;
    }

    @Override
    public boolean supports(final SourceKind kind) {
        return kind == SourceKind.FTP;
    }

    @Override
    @Retryable(retryFor = IOException.class,
               noRetryFor = FileAlreadyExistsException.class,
               maxAttemptsExpression = "#{${app.ingestion.remote.retry.attempts:2} + 1}",
               backoff = @Backoff(delayExpression = "#{${app.ingestion.remote.retry.delay-ms:1000}}"),
               listeners = "remoteTransferRetryListener")
    public List<CandidateFile> list(final String folder) throws IOException {
        return withClient(client -> {
            final FTPFile[] entries = client.listFiles(folder);
            final List<CandidateFile> files = new ArrayList<>();
            Arrays.stream(entries)
                  .filter(FTPFile::isFile)
                  .forEach(entry -> files.add(new CandidateFile(SourcePaths.join(folder, entry.getName()),
                                                                entry.getName(), entry.getSize(), null,
                                                                entry.getTimestamp() != null
                                                                        ? entry.getTimestamp().toInstant()
                                                                        : null)));
            return files;
        });
    }

    @Override
    @Retryable(retryFor = IOException.class,
               maxAttemptsExpression = "#{${app.ingestion.remote.retry.attempts:2} + 1}",
               backoff = @Backoff(delayExpression = "#{${app.ingestion.remote.retry.delay-ms:1000}}"),
               listeners = "remoteTransferRetryListener")
    public void download(final String sourcePath, final Path localTarget) throws IOException {
        Files.createDirectories(localTarget.toAbsolutePath().getParent());
        withClient(client -> {
            try (OutputStream out = Files.newOutputStream(localTarget)) {
                if (!client.retrieveFile(sourcePath, out)) {
                    throw new IOException("FTP download of " + sourcePath + " failed: " + client.getReplyString());
                }
            }
            return null;
        });
    }

    @Override
    @Retryable(retryFor = IOException.class,
               noRetryFor = FileAlreadyExistsException.class,
               maxAttemptsExpression = "#{${app.ingestion.remote.retry.attempts:2} + 1}",
               backoff = @Backoff(delayExpression = "#{${app.ingestion.remote.retry.delay-ms:1000}}"),
               listeners = "remoteTransferRetryListener")
    public void move(final String from, final String to) throws IOException {
        withClient(client -> {
            if (fileExists(client, to)) {
                throw new FileAlreadyExistsException(to);
            }
            makeDirectories(client, SourcePaths.parent(to));
            if (!client.rename(from, to)) {
                throw new IOException("FTP rename " + from + " -> " + to + " failed: " + client.getReplyString());
            }
            return null;
        });
    }

    @Override
    @Retryable(retryFor = IOException.class,
               maxAttemptsExpression = "#{${app.ingestion.remote.retry.attempts:2} + 1}",
               backoff = @Backoff(delayExpression = "#{${app.ingestion.remote.retry.delay-ms:1000}}"),
               listeners = "remoteTransferRetryListener")
    public void makeDirectories(final String folder) throws IOException {
        withClient(client -> {
            makeDirectories(client, folder);
            return null;
        });
    }

    @Override
    public boolean exists(final String path) throws IOException {
        return withClient(client -> fileExists(client, path));
    }

    @Override
    @Retryable(retryFor = IOException.class,
               maxAttemptsExpression = "#{${app.ingestion.remote.retry.attempts:2} + 1}",
               backoff = @Backoff(delayExpression = "#{${app.ingestion.remote.retry.delay-ms:1000}}"),
               listeners = "remoteTransferRetryListener")
    public void writeText(final String path, final String content) throws IOException {
        withClient(client -> {
            makeDirectories(client, SourcePaths.parent(path));
            try (InputStream in = new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8))) {
                if (!client.storeFile(path, in)) {
                    throw new IOException("FTP upload of " + path + " failed: " + client.getReplyString());
                }
            }
            return null;
        });
    }

    @Override
    public void delete(final String path) throws IOException {
        withClient(client -> {
            if (!client.deleteFile(path) && fileExists(client, path)) {
                throw new IOException("FTP delete of " + path + " failed: " + client.getReplyString());
            }
            return null;
        });
    }

    private boolean fileExists(final FTPClient client, final String path) throws IOException {
        final String name = SourcePaths.fileName(path);
        return Arrays.stream(client.listFiles(SourcePaths.parent(path)))
                     .anyMatch(entry -> name.equals(entry.getName()));
    }

    private void makeDirectories(final FTPClient client, final String folder) throws IOException {
        if (folder == null || folder.isEmpty() || "/".equals(folder)) {
            return;
        }
        final String original = client.printWorkingDirectory();
        final StringBuilder current = new StringBuilder(folder.startsWith("/") ? "/" : "");
        for (String segment : folder.split("/")) {
            if (segment.isEmpty()) {
                continue;
            }
            current.append(segment);
            if (!client.changeWorkingDirectory(current.toString()) && !client.makeDirectory(current.toString())) {
                throw new IOException("Could not create FTP folder " + current + ": " + client.getReplyString());
            }
            current.append('/');
        }
        client.changeWorkingDirectory(original);
    }

    private <T> T withClient(final FtpOperation<T> operation) throws IOException {
        final IngestionProperties.Remote remote = properties.getRemote();
        final FTPClient client = new FTPClient();
        client.setConnectTimeout(remote.getConnectTimeoutMs());
        try {
            client.connect(remote.getHost(), remote.getPort() > 0 ? remote.getPort() : FTP.DEFAULT_PORT);
            if (!FTPReply.isPositiveCompletion(client.getReplyCode())) {
                throw new IOException("FTP server refused connection: " + client.getReplyString());
            }
            if (!client.login(remote.getUsername(), remote.getPassword())) {
                throw new IOException("FTP login failed for user " + remote.getUsername());
            }
            if (remote.isPassiveMode()) {
                client.enterLocalPassiveMode();
            }
            client.setFileType(FTP.BINARY_FILE_TYPE);
            return operation.execute(client);
        } finally {
            disconnectQuietly(client);
        }
    }

    private void disconnectQuietly(final FTPClient client) {
        if (!client.isConnected()) {
            return;
        }
        try {
            client.logout();
            client.disconnect();
        } catch (IOException e) {
            log.debug("Ignoring error while closing FTP connection: {}", e.getMessage());
        }
    }
}
