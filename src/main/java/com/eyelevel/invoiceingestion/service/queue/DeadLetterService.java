package com.eyelevel.invoiceingestion.service.queue;

import com.eyelevel.invoiceingestion.model.DeadLetterRecord;
import com.eyelevel.invoiceingestion.model.QueueJob;
import com.eyelevel.invoiceingestion.repository.DeadLetterRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.LocalDateTime;

/**
 * Keeps an append-only record of every job that exhausted its attempts or failed unrecoverably.
 * <p>
 * Records are written in their own transaction so the evidence survives even when the caller rolls back.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeadLetterService {

    private final DeadLetterRecordRepository deadLetterRecordRepository;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void record(final QueueJob job, final int attemptsMade, final String reason, final Throwable error) {
        try {
            final DeadLetterRecord deadLetter = deadLetterRecordRepository.save(
                    DeadLetterRecord.builder()
                                    .originalQueue(job.getQueueName())
                                    .originalJobId(job.getId())
                                    .jobName(job.getJobName())
                                    .payloadSnapshot(job.getPayload())
                                    .failureReason(reason)
                                    .stackTrace(error == null ? null : stackTraceOf(error))
                                    .attemptsMade(attemptsMade)
                                    .failedAt(LocalDateTime.now())
                                    .build());
            log.error("[Queue: {}, JobId: {}] Job '{}' dead-lettered as record {}. Reason: {}", job.getQueueName(),
                      job.getId(), job.getJobName(), deadLetter.getId(), reason);
        } catch (Exception e) {
            log.error("CRITICAL: Failed to dead-letter job {} of queue {}. Reason was: {}", job.getId(),
                      job.getQueueName(), reason, e);
        }
    }

    @Transactional(readOnly = true)
    public Page<DeadLetterRecord> list(final Pageable pageable) {
        return deadLetterRecordRepository.findAllByOrderByFailedAtDesc(pageable);
    }

    private static String stackTraceOf(final Throwable error) {
        final StringWriter writer = new StringWriter();
        error.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }
}
