package com.eyelevel.invoiceingestion.service.queue;

import com.eyelevel.invoiceingestion.exception.ResourceNotFoundException;
import com.eyelevel.invoiceingestion.model.ImportBatch;
import com.eyelevel.invoiceingestion.model.ImportBatchStatus;
import com.eyelevel.invoiceingestion.model.JobStatus;
import com.eyelevel.invoiceingestion.model.SourceKind;
import com.eyelevel.invoiceingestion.repository.ImportBatchRepository;
import com.eyelevel.invoiceingestion.repository.QueueJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Tracks multi-file imports and supports cooperative cancellation. Cancelling a batch removes its queued jobs;
 * jobs already running notice the cancellation at their next file or network boundary.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ImportBatchService {

    private static final List<JobStatus> CANCELLABLE = List.of(JobStatus.WAITING, JobStatus.DELAYED);

    private final ImportBatchRepository importBatchRepository;
    private final QueueJobRepository queueJobRepository;

    @Transactional
    public ImportBatch open(final SourceKind sourceKind) {
        final ImportBatch batch = importBatchRepository.save(ImportBatch.builder()
                                                                        .id(UUID.randomUUID().toString())
                                                                        .status(ImportBatchStatus.RUNNING)
                                                                        .sourceKind(sourceKind)
                                                                        .build());
        log.debug("Opened import batch {} for {}.", batch.getId(), sourceKind);
        return batch;
    }

    @Transactional
    public void recordCounts(final String batchId, final int total, final int queued) {
        importBatchRepository.findById(batchId).ifPresent(batch -> {
            batch.setTotal(total);
            batch.setQueued(queued);
            if (queued == 0 && batch.getStatus() == ImportBatchStatus.RUNNING) {
                batch.setStatus(ImportBatchStatus.COMPLETED);
                batch.setFinishedAt(LocalDateTime.now());
            }
            importBatchRepository.save(batch);
        });
    }

    /**
     * Marks the batch CANCELLED and deletes its WAITING and DELAYED jobs.
     *
     * @return the number of queued jobs removed
     */
    @Transactional
    public int cancel(final String batchId) {
        if (!importBatchRepository.existsById(batchId)) {
            throw new ResourceNotFoundException("Import batch " + batchId + " not found.");
        }
        final int updated = importBatchRepository.updateStatusIfExpected(batchId, ImportBatchStatus.CANCELLED,
                                                                         ImportBatchStatus.RUNNING);
        if (updated == 0) {
            log.info("Import batch {} is not running. Nothing to cancel.", batchId);
            return 0;
        }
        final int removed = queueJobRepository.deleteByImportBatch(batchId, CANCELLABLE);
        log.warn("Cancelled import batch {}. Removed {} queued job(s).", batchId, removed);
        return removed;
    }

    @Transactional(readOnly = true)
    public boolean isCancelled(final String batchId) {
        return batchId != null && importBatchRepository.existsByIdAndStatus(batchId, ImportBatchStatus.CANCELLED);
    }

    /**
     * Completes a running batch once none of its jobs is pending any more.
     */
    @Transactional
    public void completeIfDrained(final String batchId) {
        if (batchId == null || queueJobRepository.existsByImportBatchIdAndStatusIn(batchId, JobStatus.PENDING)) {
            return;
        }
        if (importBatchRepository.updateStatusIfExpected(batchId, ImportBatchStatus.COMPLETED,
                                                         ImportBatchStatus.RUNNING) == 1) {
            log.info("Import batch {} completed.", batchId);
        }
    }
}
