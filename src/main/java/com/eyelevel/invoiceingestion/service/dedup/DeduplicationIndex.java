package com.eyelevel.invoiceingestion.service.dedup;

import com.eyelevel.invoiceingestion.model.DocumentRecord;
import com.eyelevel.invoiceingestion.model.DocumentStatus;
import com.eyelevel.invoiceingestion.repository.DocumentRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Answers whether content with a given digest has already been ingested.
 * <p>
 * A live (not soft-deleted) document always counts. A soft-deleted document counts while it is inside the
 * retention window; once it was deleted more than {@code retentionDays} ago the content may be ingested
 * again. Without a retention window, hash records are kept forever and soft-deleted documents keep counting.
 * Duplicate and failed records never count as the original.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeduplicationIndex {

    private static final List<DocumentStatus> NOT_ORIGINALS = List.of(DocumentStatus.DUPLICATE,
                                                                     DocumentStatus.FAILED);

    private final DocumentRecordRepository documentRecordRepository;

    public Optional<DocumentRecord> findDuplicate(final String contentDigest, final Integer retentionDays) {
        final Optional<DocumentRecord> live = documentRecordRepository
                .findFirstByContentDigestAndStatusNotInAndDeletedAtIsNullOrderByIdAsc(contentDigest, NOT_ORIGINALS);
        if (live.isPresent()) {
            return live;
        }

        if (retentionDays == null || retentionDays <= 0) {
            return documentRecordRepository.findFirstByContentDigestAndStatusNotInOrderByIdAsc(contentDigest,
                                                                                              NOT_ORIGINALS);
        }

        final LocalDateTime windowStart = LocalDateTime.now().minusDays(retentionDays);
        final Optional<DocumentRecord> recentlyDeleted = documentRecordRepository
                .findFirstByContentDigestAndStatusNotInAndDeletedAtAfterOrderByIdAsc(contentDigest, NOT_ORIGINALS,
                                                                                    windowStart);
        if (recentlyDeleted.isEmpty()) {
            log.debug("Digest {} has no live or recently deleted document. Treating as new content.", contentDigest);
        }
        return recentlyDeleted;
    }
}
