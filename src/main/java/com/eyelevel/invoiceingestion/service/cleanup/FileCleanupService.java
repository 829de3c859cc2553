package com.eyelevel.invoiceingestion.service.cleanup;

import com.eyelevel.invoiceingestion.model.DocumentRecord;
import com.eyelevel.invoiceingestion.model.SourceKind;
import com.eyelevel.invoiceingestion.repository.DocumentRecordRepository;
import com.eyelevel.invoiceingestion.service.settings.PipelineSettings;
import com.eyelevel.invoiceingestion.service.settings.PipelineSettingsProvider;
import com.eyelevel.invoiceingestion.service.source.SourceConnector;
import com.eyelevel.invoiceingestion.service.source.SourceConnectorFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Applies document retention: documents older than {@code retentionDays} are soft-deleted and their files
 * removed. The digest stays on the record, so the content keeps counting as a duplicate for another retention
 * window after deletion. Nothing happens when retention is unlimited.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FileCleanupService {

    static final int BATCH_SIZE = 200;

    private final DocumentRecordRepository documentRecordRepository;
    private final PipelineSettingsProvider settingsProvider;
    private final SourceConnectorFactory connectorFactory;

    /**
     * @return the number of documents soft-deleted
     */
    public int cleanup() {
        final PipelineSettings settings = settingsProvider.current();
        if (!settings.hasRetention()) {
            log.info("Document retention is unlimited. Skipping cleanup.");
            return 0;
        }
        final LocalDateTime cutoff = LocalDateTime.now().minusDays(settings.retentionDays());
        log.info("Running document cleanup for documents created before {}.", cutoff);

        int deleted = 0;
        long lastBatchFirstId = -1;
        while (true) {
            final List<DocumentRecord> expired = documentRecordRepository.findExpired(cutoff,
                                                                                      PageRequest.of(0, BATCH_SIZE));
            if (expired.isEmpty() || expired.get(0).getId() == lastBatchFirstId) {
                break;
            }
            lastBatchFirstId = expired.get(0).getId();
            for (DocumentRecord record : expired) {
                try {
                    deletePhysicalFile(record);
                    record.setDeletedAt(LocalDateTime.now());
                    record.setLiveDigest(null);
                    documentRecordRepository.save(record);
                    deleted++;
                } catch (Exception e) {
                    log.error("Failed to clean up document {} ('{}'). It will be retried on the next run.",
                              record.getId(), record.getFileName(), e);
                }
            }
            if (expired.size() < BATCH_SIZE) {
                break;
            }
        }
        log.info("Document cleanup finished. Soft-deleted {} document(s).", deleted);
        return deleted;
    }

    private void deletePhysicalFile(final DocumentRecord record) throws IOException {
        if (record.getFileLocation() == null) {
            return;
        }
        final SourceKind kind = record.getSourceKind() == null ? SourceKind.LOCAL : record.getSourceKind();
        final SourceConnector connector = connectorFactory.getConnector(kind);
        if (connector.exists(record.getFileLocation())) {
            connector.delete(record.getFileLocation());
            log.debug("Deleted file {} of document {}.", record.getFileLocation(), record.getId());
        }
    }
}
