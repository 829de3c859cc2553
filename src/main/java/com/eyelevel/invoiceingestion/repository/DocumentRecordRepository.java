package com.eyelevel.invoiceingestion.repository;

import com.eyelevel.invoiceingestion.model.DocumentRecord;
import com.eyelevel.invoiceingestion.model.DocumentStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA repository for the {@link DocumentRecord} entity.
 */
@Repository
public interface DocumentRecordRepository extends JpaRepository<DocumentRecord, Long> {

    @Transactional(readOnly = true)
    Optional<DocumentRecord> findFirstByContentDigestAndStatusNotInAndDeletedAtIsNullOrderByIdAsc(
            String contentDigest, Collection<DocumentStatus> excludedStatuses);

    @Transactional(readOnly = true)
    Optional<DocumentRecord> findFirstByContentDigestAndStatusNotInAndDeletedAtAfterOrderByIdAsc(
            String contentDigest, Collection<DocumentStatus> excludedStatuses, LocalDateTime deletedAfter);

    @Transactional(readOnly = true)
    Optional<DocumentRecord> findFirstByContentDigestAndStatusNotInOrderByIdAsc(
            String contentDigest, Collection<DocumentStatus> excludedStatuses);

    @Transactional(readOnly = true)
    Optional<DocumentRecord> findFirstByContentDigestAndStatusInAndDeletedAtIsNullOrderByIdAsc(
            String contentDigest, Collection<DocumentStatus> statuses);

    @Transactional(readOnly = true)
    Optional<DocumentRecord> findFirstByContentDigestAndFileNameAndStatusInAndDeletedAtIsNullOrderByIdDesc(
            String contentDigest, String fileName, Collection<DocumentStatus> statuses);

    @Transactional(readOnly = true)
    boolean existsByFileNameAndCreatedAtAfter(String fileName, LocalDateTime createdAfter);

    @Modifying(clearAutomatically = true)
    @Query("update DocumentRecord d set d.status = :newStatus where d.id = :id and d.status = :expectedStatus")
    int updateStatusIfExpected(@Param("id") Long id, @Param("newStatus") DocumentStatus newStatus,
                               @Param("expectedStatus") DocumentStatus expectedStatus);

    @Modifying(clearAutomatically = true)
    @Query("update DocumentRecord d set d.fileLocation = :location where d.id = :id")
    int updateFileLocation(@Param("id") Long id, @Param("location") String location);

    @Query("""
            select d from DocumentRecord d
            where d.deletedAt is null and d.createdAt < :cutoff order by d.id asc""")
    List<DocumentRecord> findExpired(@Param("cutoff") LocalDateTime cutoff, Pageable pageable);
}
