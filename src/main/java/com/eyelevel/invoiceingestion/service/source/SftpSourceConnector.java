package com.eyelevel.invoiceingestion.service.source;

import com.eyelevel.invoiceingestion.config.IngestionProperties;
import com.eyelevel.invoiceingestion.model.SourceKind;
import com.jcraft.jsch.ChannelSftp;
import com.jcraft.jsch.JSch;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;
import com.jcraft.jsch.SftpATTRS;
import com.jcraft.jsch.SftpException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A {@link SourceConnector} for SFTP drop folders, built on JSch.
 * <p>
 * Each operation opens a session and an {@code sftp} channel and disconnects both afterwards. JSch's checked
 * exceptions are surfaced as {@link IOException}s so the retry policy treats all transport failures alike.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SftpSourceConnector implements SourceConnector {

    private static final int DEFAULT_PORT = 22;

    private final IngestionProperties properties;

    @FunctionalInterface
    interface SftpOperation<T> {
        T execute(ChannelSftp channel) throws SftpException, IOException;
    }

    @Override
    public boolean supports(final SourceKind kind) {
        return kind == SourceKind.SFTP;
    }

    @Override
    @Retryable(retryFor = IOException.class,
               maxAttemptsExpression = "#{${app.ingestion.remote.retry.attempts:2} + 1}",
               backoff = @Backoff(delayExpression = "#{${app.ingestion.remote.retry.delay-ms:1000}}"),
               listeners = "remoteTransferRetryListener")
    public List<CandidateFile> list(final String folder) throws IOException {
        return withChannel(channel -> {
            final List<CandidateFile> files = new ArrayList<>();
            if (stat(channel, folder) == null) {
                return files;
            }
            for (ChannelSftp.LsEntry entry : channel.ls(folder)) {
                final SftpATTRS attrs = entry.getAttrs();
                if (attrs.isDir() || attrs.isLink() || entry.getFilename().startsWith(".")) {
                    continue;
                }
                files.add(new CandidateFile(SourcePaths.join(folder, entry.getFilename()), entry.getFilename(),
                                            attrs.getSize(), null, Instant.ofEpochSecond(attrs.getMTime())));
            }
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
        withChannel(channel -> {
            try (OutputStream out = Files.newOutputStream(localTarget)) {
                channel.get(sourcePath, out);
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
        withChannel(channel -> {
            if (stat(channel, to) != null) {
                throw new FileAlreadyExistsException(to);
            }
            makeDirectories(channel, SourcePaths.parent(to));
            channel.rename(from, to);
            return null;
        });
    }

    @Override
    public void makeDirectories(final String folder) throws IOException {
        withChannel(channel -> {
            makeDirectories(channel, folder);
            return null;
        });
    }

    @Override
    public boolean exists(final String path) throws IOException {
        return withChannel(channel -> stat(channel, path) != null);
    }

    @Override
    public void writeText(final String path, final String content) throws IOException {
        withChannel(channel -> {
            makeDirectories(channel, SourcePaths.parent(path));
            channel.put(new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8)), path);
            return null;
        });
    }

    @Override
    public void delete(final String path) throws IOException {
        withChannel(channel -> {
            if (stat(channel, path) != null) {
                channel.rm(path);
            }
            return null;
        });
    }

    private SftpATTRS stat(final ChannelSftp channel, final String path) throws SftpException {
        try {
            return channel.stat(path);
        } catch (SftpException e) {
            if (e.id == ChannelSftp.SSH_FX_NO_SUCH_FILE) {
                return null;
            }
            throw e;
        }
    }

    private void makeDirectories(final ChannelSftp channel, final String folder) throws SftpException {
        if (folder == null || folder.isEmpty() || "/".equals(folder)) {
            return;
        }
        final StringBuilder current = new StringBuilder(folder.startsWith("/") ? "/" : "");
        for (String segment : folder.split("/")) {
            if (segment.isEmpty()) {
                continue;
            }
            current.append(segment);
            if (stat(channel, current.toString()) == null) {
                channel.mkdir(current.toString());
            }
            current.append('/');
        }
    }

    private <T> T withChannel(final SftpOperation<T> operation) throws IOException {
        final IngestionProperties.Remote remote = properties.getRemote();
        Session session = null;
        ChannelSftp channel = null;
        try {
            final JSch jsch = new JSch();
            if (remote.getKnownHostsFile() != null) {
                jsch.setKnownHosts(remote.getKnownHostsFile());
            }
            session = jsch.getSession(remote.getUsername(), remote.getHost(),
                                      remote.getPort() > 0 ? remote.getPort() : DEFAULT_PORT);
            session.setPassword(remote.getPassword());
            session.setConfig("StrictHostKeyChecking", remote.getKnownHostsFile() != null ? "yes" : "no");
            session.connect(remote.getConnectTimeoutMs());
            channel = (ChannelSftp) session.openChannel("sftp");
            channel.connect(remote.getConnectTimeoutMs());
            return operation.execute(channel);
        } catch (JSchException | SftpException e) {
            throw new IOException("SFTP operation on " + remote.getHost() + " failed: " + e.getMessage(), e);
        } finally {
            if (channel != null) {
                channel.disconnect();
            }
            if (session != null) {
                session.disconnect();
            }
        }
    }
}
