package com.eyelevel.invoiceingestion.service.pipeline;

import com.eyelevel.invoiceingestion.common.json.JsonSerializer;
import com.eyelevel.invoiceingestion.model.DocumentRecord;
import com.eyelevel.invoiceingestion.model.DocumentStatus;
import com.eyelevel.invoiceingestion.model.DocumentType;
import com.eyelevel.invoiceingestion.model.FailureReason;
import com.eyelevel.invoiceingestion.model.SourceKind;
import com.eyelevel.invoiceingestion.repository.DocumentRecordRepository;
import com.eyelevel.invoiceingestion.service.extraction.ExtractionOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Owns every state change of a {@link DocumentRecord}. Each method commits on its own, so a file move that
 * fails afterwards never rolls back what was learned about the document.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentRecordService {

    private static final List<DocumentStatus> SETTLED = List.of(DocumentStatus.PARSED, DocumentStatus.UNALLOCATED,
                                                                DocumentStatus.DUPLICATE);
    private static final List<DocumentStatus> REOPENABLE = List.of(DocumentStatus.PROCESSING, DocumentStatus.FAILED);
    private static final List<DocumentStatus> NOT_ORIGINALS = List.of(DocumentStatus.DUPLICATE,
                                                                     DocumentStatus.FAILED);

    private final DocumentRecordRepository documentRecordRepository;
    private final JsonSerializer jsonSerializer;

    /**
     * Finds the record an earlier run of the same file already settled.
     */
    @Transactional(readOnly = true)
    public Optional<DocumentRecord> findSettled(final String contentDigest, final String fileName) {
        return documentRecordRepository.findFirstByContentDigestAndFileNameAndStatusInAndDeletedAtIsNullOrderByIdDesc(
                contentDigest, fileName, SETTLED);
    }

    /**
     * Creates the PROCESSING record for a file, or reopens the one a previous failed or interrupted attempt left
     * behind. The record claims the live digest, so a concurrent import of the same content fails here with a
     * {@link org.springframework.dao.DataIntegrityViolationException}.
     */
    @Transactional
    public DocumentRecord createProcessing(final String fileName, final String contentDigest,
                                           final SourceKind sourceKind, final String fileLocation,
                                           final String importBatchId) {
        final DocumentRecord record = documentRecordRepository
                .findFirstByContentDigestAndFileNameAndStatusInAndDeletedAtIsNullOrderByIdDesc(contentDigest,
                                                                                               fileName, REOPENABLE)
                .orElseGet(() -> DocumentRecord.builder()
                                               .fileName(fileName)
                                               .contentDigest(contentDigest)
                                               .sourceKind(sourceKind)
                                               .build());
        if (record.getId() != null) {
            log.info("[Document: {}] Reopening record left in {} by an earlier attempt.", record.getId(),
                     record.getStatus());
        }
        record.setStatus(DocumentStatus.PROCESSING);
        record.setLiveDigest(contentDigest);
        record.setFailureReason(null);
        record.setErrorMessage(null);
        record.setFileLocation(fileLocation);
        record.setImportBatchId(importBatchId);
        return documentRecordRepository.saveAndFlush(record);
    }

    /**
     * Records a file whose content is already held by {@code original}. Duplicates never claim the live digest.
     */
    @Transactional
    public DocumentRecord recordDuplicate(final String fileName, final String contentDigest,
                                          final SourceKind sourceKind, final DocumentRecord original,
                                          final String fileLocation, final String importBatchId) {
        final DocumentRecord duplicate = documentRecordRepository.save(
                DocumentRecord.builder()
                              .fileName(fileName)
                              .contentDigest(contentDigest)
                              .status(DocumentStatus.DUPLICATE)
                              .failureReason(FailureReason.DUPLICATE)
                              .duplicateOfId(original.getId())
                              .documentType(original.getDocumentType())
                              .errorMessage("Duplicate of document " + original.getId())
                              .sourceKind(sourceKind)
                              .fileLocation(fileLocation)
                              .importBatchId(importBatchId)
                              .build());
        log.info("[Document: {}] '{}' is a duplicate of document {}.", duplicate.getId(), fileName, original.getId());
        return duplicate;
    }

    /**
     * The live original for a digest, used after losing the race for it.
     */
    @Transactional(readOnly = true)
    public Optional<DocumentRecord> findLiveOriginal(final String contentDigest) {
        return documentRecordRepository.findFirstByContentDigestAndStatusNotInAndDeletedAtIsNullOrderByIdAsc(
                contentDigest, NOT_ORIGINALS);
    }

    @Transactional
    public DocumentRecord markParsed(final Long recordId, final ExtractionOutcome outcome, final Long companyId,
                                     final String note) {
        return settle(recordId, outcome, DocumentStatus.PARSED, companyId, null, note);
    }

    @Transactional
    public DocumentRecord markUnallocated(final Long recordId, final ExtractionOutcome outcome,
                                          final FailureReason reason, final String message) {
        return settle(recordId, outcome, DocumentStatus.UNALLOCATED, null, reason, message);
    }

    @Transactional
    public void updateFileLocation(final Long recordId, final String location) {
        documentRecordRepository.updateFileLocation(recordId, location);
    }

    /**
     * Marks the record FAILED in a new, independent transaction and releases its live digest.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(final Long recordId, final String errorMessage) {
        log.warn("Executing failure protocol for document {}.", recordId);
        try {
            final DocumentRecord record = documentRecordRepository.findById(recordId).orElse(null);
            if (record == null) {
                log.error("Could not find document {} to mark as failed.", recordId);
                return;
            }
            record.setStatus(DocumentStatus.FAILED);
            record.setFailureReason(FailureReason.PARSING_ERROR);
            record.setErrorMessage(errorMessage);
            record.setLiveDigest(null);
            documentRecordRepository.save(record);
            log.info("Persisted FAILED status for document {}.", recordId);
        } catch (Exception e) {
            log.error("CRITICAL: Failed to execute the failure protocol for document {}. Its state might be "
                      + "inconsistent.", recordId, e);
        }
    }

    private DocumentRecord settle(final Long recordId, final ExtractionOutcome outcome, final DocumentStatus status,
                                  final Long companyId, final FailureReason reason, final String message) {
        final DocumentRecord record = documentRecordRepository.findById(recordId)
                                                              .orElseThrow(() -> new IllegalStateException(
                                                                      "Document " + recordId + " disappeared"));
        final DocumentType type = outcome.documentType();
        record.setStatus(status);
        record.setDocumentType(type);
        record.setMatchedCompanyId(companyId);
        record.setTemplateId(outcome.result().templateId());
        record.setExtractionResult(jsonSerializer.serialize(outcome.result()));
        record.setConfidenceScore(outcome.confidenceScore());
        record.setFailureReason(reason);
        record.setErrorMessage(message);
        final DocumentRecord saved = documentRecordRepository.save(record);
        log.info("[Document: {}] {} as {} (confidence {}{}).", recordId, status, type, outcome.confidenceScore(),
                 reason == null ? "" : ", reason " + reason.getCode());
        return saved;
    }
}
