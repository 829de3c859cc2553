package com.eyelevel.invoiceingestion.service.job;

import com.eyelevel.invoiceingestion.config.IngestionProperties;
import com.eyelevel.invoiceingestion.exception.SourceAccessException;
import com.eyelevel.invoiceingestion.model.DocumentRecord;
import com.eyelevel.invoiceingestion.model.DocumentStatus;
import com.eyelevel.invoiceingestion.model.SourceKind;
import com.eyelevel.invoiceingestion.repository.DocumentRecordRepository;
import com.eyelevel.invoiceingestion.service.dedup.DeduplicationIndex;
import com.eyelevel.invoiceingestion.service.hash.ContentHasher;
import com.eyelevel.invoiceingestion.service.pipeline.DocumentRecordService;
import com.eyelevel.invoiceingestion.service.queue.ImportBatchService;
import com.eyelevel.invoiceingestion.service.queue.JobContext;
import com.eyelevel.invoiceingestion.service.queue.JobQueueService;
import com.eyelevel.invoiceingestion.service.queue.QueueName;
import com.eyelevel.invoiceingestion.service.queue.payload.FileImportPayload;
import com.eyelevel.invoiceingestion.service.queue.payload.InvoiceImportPayload;
import com.eyelevel.invoiceingestion.service.routing.FileRouter;
import com.eyelevel.invoiceingestion.service.routing.TerminalState;
import com.eyelevel.invoiceingestion.service.settings.PipelineSettingsProvider;
import com.eyelevel.invoiceingestion.service.source.LocalSourceConnector;
import com.eyelevel.invoiceingestion.service.source.SourceConnectorFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FileImportJobHandlerTest {

    @Mock
    private SourceConnectorFactory connectorFactory;
    @Mock
    private DocumentRecordRepository documentRecordRepository;
    @Mock
    private DocumentRecordService documentRecordService;
    @Mock
    private FileRouter fileRouter;
    @Mock
    private JobQueueService jobQueueService;
    @Mock
    private ImportBatchService importBatchService;

    @TempDir
    Path tempDir;

    private final ContentHasher contentHasher = new ContentHasher();
    private Path remoteFile;
    private Path stagingDir;
    private FileImportJobHandler handler;

    @BeforeEach
    void setUp() throws IOException {
        final IngestionProperties properties = new IngestionProperties();
        stagingDir = tempDir.resolve("staging");
        properties.setStagingDir(stagingDir.toString());
        properties.setRetentionDays(90);
        remoteFile = Files.writeString(Files.createDirectories(tempDir.resolve("remote/unprocessed"))
                                            .resolve("acme.pdf"), "%PDF-1.7 acme");
        handler = new FileImportJobHandler(new PipelineSettingsProvider(properties), connectorFactory, contentHasher,
                                           new DeduplicationIndex(documentRecordRepository), documentRecordService,
                                           fileRouter, jobQueueService, importBatchService);
        lenient().when(connectorFactory.getConnector(SourceKind.SFTP)).thenReturn(new LocalSourceConnector());
    }

    @Test
    @SuppressWarnings("unchecked")
    void stagesNewFileAndQueuesImport() throws Exception {
        final String digest = contentHasher.digest(remoteFile);

        final Map<String, Object> result = (Map<String, Object>) handler.handle(context(), payload("batch-2"));

        assertThat(result).containsEntry("outcome", "queued");
        final ArgumentCaptor<InvoiceImportPayload> queued = ArgumentCaptor.forClass(InvoiceImportPayload.class);
        verify(jobQueueService).enqueue(eq(QueueName.INVOICE_IMPORT), eq(FileImportJobHandler.INVOICE_IMPORT_JOB),
                                        queued.capture(), eq("acme.pdf"));
        assertThat(queued.getValue().contentDigest()).isEqualTo(digest);
        assertThat(queued.getValue().remotePath()).isEqualTo(remoteFile.toString());
        assertThat(queued.getValue().importBatchId()).isEqualTo("batch-2");
        assertThat(Path.of(queued.getValue().localPath())).exists().startsWith(stagingDir);
    }

    @Test
    @SuppressWarnings("unchecked")
    void duplicateDownloadIsRoutedAndStagedCopyRemoved() throws Exception {
        final DocumentRecord original = DocumentRecord.builder().id(3L).fileName("acme-old.pdf")
                                                      .status(DocumentStatus.PARSED).build();
        final DocumentRecord duplicate = DocumentRecord.builder().id(4L).status(DocumentStatus.DUPLICATE).build();
        when(documentRecordRepository.findFirstByContentDigestAndStatusNotInAndDeletedAtIsNullOrderByIdAsc(
                anyString(), any())).thenReturn(Optional.of(original));
        when(documentRecordService.recordDuplicate(eq("acme.pdf"), anyString(), eq(SourceKind.SFTP), eq(original),
                                                   eq(remoteFile.toString()), isNull())).thenReturn(duplicate);
        when(fileRouter.route(any(), any(), eq(remoteFile.toString()), eq(TerminalState.DUPLICATE), isNull()))
                .thenReturn("/remote/processed/acme.pdf");

        final Map<String, Object> result = (Map<String, Object>) handler.handle(context(), payload(null));

        assertThat(result).containsEntry("outcome", "duplicate");
        verify(documentRecordService).updateFileLocation(4L, "/remote/processed/acme.pdf");
        verify(jobQueueService, never()).enqueue(any(), anyString(), any(), anyString());
        try (Stream<Path> staged = Files.list(stagingDir)) {
            assertThat(staged).isEmpty();
        }
    }

    @Test
    @SuppressWarnings("unchecked")
    void sameContentAlreadyQueuedLeavesRemoteFileInPlace() throws Exception {
        final String digest = contentHasher.digest(remoteFile);
        when(jobQueueService.isContentQueued(QueueName.INVOICE_IMPORT, digest)).thenReturn(true);

        final Map<String, Object> result = (Map<String, Object>) handler.handle(context(), payload(null));

        assertThat(result).containsEntry("outcome", "already_queued");
        assertThat(remoteFile).exists();
        verify(jobQueueService, never()).enqueue(any(), anyString(), any(), anyString());
        verifyNoInteractions(documentRecordService, fileRouter);
        try (Stream<Path> staged = Files.list(stagingDir)) {
            assertThat(staged).isEmpty();
        }
    }

    @Test
    @SuppressWarnings("unchecked")
    void cancelledBatchSkipsDownload() throws Exception {
        when(importBatchService.isCancelled("batch-2")).thenReturn(true);

        final Map<String, Object> result = (Map<String, Object>) handler.handle(context(), payload("batch-2"));

        assertThat(result).containsEntry("outcome", "cancelled");
        verifyNoInteractions(connectorFactory, jobQueueService);
    }

    @Test
    void failedDownloadIsRetryableSourceError() {
        final FileImportPayload missing = new FileImportPayload(SourceKind.SFTP,
                                                                tempDir.resolve("remote/unprocessed/gone.pdf")
                                                                       .toString(),
                                                                "gone.pdf", null, null);

        assertThatThrownBy(() -> handler.handle(context(), missing))
                .isInstanceOf(SourceAccessException.class)
                .hasMessageContaining("gone.pdf");
    }

    private FileImportPayload payload(final String importBatchId) {
        return new FileImportPayload(SourceKind.SFTP, remoteFile.toString(), "acme.pdf", null, importBatchId);
    }

    private static JobContext context() {
        return new JobContext(15L, QueueName.FILE_IMPORT, "download-file", 1, 3, null);
    }
}
