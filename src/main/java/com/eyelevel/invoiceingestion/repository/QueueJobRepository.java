package com.eyelevel.invoiceingestion.repository;

import com.eyelevel.invoiceingestion.model.JobStatus;
import com.eyelevel.invoiceingestion.model.QueueJob;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

/**
 * Spring Data JPA repository for the {@link QueueJob} entity.
 * <p>
 * Every lifecycle transition is a conditional UPDATE returning the affected row count. A count of zero
 * means the job was not in the expected state or the caller no longer holds its lock.
 */
@Repository
public interface QueueJobRepository extends JpaRepository<QueueJob, Long> {

    @Query("""
            select j.id from QueueJob j
            where j.queueName = :queueName and j.status = :status and j.availableAt <= :now
            order by j.priority desc, j.id asc""")
    List<Long> findReadyIds(@Param("queueName") String queueName, @Param("status") JobStatus status,
                            @Param("now") LocalDateTime now, Pageable pageable);

    @Modifying(clearAutomatically = true)
    @Query("""
            update QueueJob j
            set j.status = :active, j.lockToken = :token, j.lockExpiresAt = :lockExpiresAt,
                j.attemptsMade = j.attemptsMade + 1
            where j.id = :id and j.status = :expected""")
    int claim(@Param("id") Long id, @Param("token") String token, @Param("lockExpiresAt") LocalDateTime lockExpiresAt,
              @Param("active") JobStatus active, @Param("expected") JobStatus expected);

    @Modifying(clearAutomatically = true)
    @Query("""
            update QueueJob j set j.lockExpiresAt = :lockExpiresAt
            where j.id = :id and j.lockToken = :token and j.status = :active""")
    int renewLock(@Param("id") Long id, @Param("token") String token,
                  @Param("lockExpiresAt") LocalDateTime lockExpiresAt, @Param("active") JobStatus active);

    @Modifying(clearAutomatically = true)
    @Query("""
            update QueueJob j
            set j.status = :newStatus, j.lockToken = null, j.lockExpiresAt = null, j.returnValue = :returnValue,
                j.lastError = :lastError, j.availableAt = :availableAt, j.finishedAt = :finishedAt
            where j.id = :id and j.lockToken = :token and j.status = :active""")
    int finish(@Param("id") Long id, @Param("token") String token, @Param("newStatus") JobStatus newStatus,
               @Param("returnValue") String returnValue, @Param("lastError") String lastError,
               @Param("availableAt") LocalDateTime availableAt, @Param("finishedAt") LocalDateTime finishedAt,
               @Param("active") JobStatus active);

    @Modifying(clearAutomatically = true)
    @Query("""
            update QueueJob j set j.status = :waiting
            where j.queueName = :queueName and j.status = :delayed and j.availableAt <= :now""")
    int promoteDelayed(@Param("queueName") String queueName, @Param("now") LocalDateTime now,
                       @Param("delayed") JobStatus delayed, @Param("waiting") JobStatus waiting);

    @Query("""
            select j from QueueJob j
            where j.queueName = :queueName and j.status = :active and j.lockExpiresAt < :now""")
    List<QueueJob> findStalled(@Param("queueName") String queueName, @Param("now") LocalDateTime now,
                               @Param("active") JobStatus active);

    @Modifying(clearAutomatically = true)
    @Query("""
            update QueueJob j
            set j.status = :waiting, j.stalledCount = j.stalledCount + 1, j.attemptsMade = j.attemptsMade - 1,
                j.lockToken = null, j.lockExpiresAt = null
            where j.id = :id and j.lockToken = :token and j.status = :active""")
    int requeueStalled(@Param("id") Long id, @Param("token") String token, @Param("waiting") JobStatus waiting,
                       @Param("active") JobStatus active);

    @Modifying(clearAutomatically = true)
    @Query("""
            update QueueJob j
            set j.status = :failed, j.stalledCount = j.stalledCount + 1, j.attemptsMade = j.maxAttempts,
                j.lockToken = null, j.lockExpiresAt = null, j.lastError = :error, j.finishedAt = :now
            where j.id = :id and j.lockToken = :token and j.status = :active""")
    int failStalled(@Param("id") Long id, @Param("token") String token, @Param("error") String error,
                    @Param("now") LocalDateTime now, @Param("failed") JobStatus failed,
                    @Param("active") JobStatus active);

    boolean existsByQueueNameAndDedupKeyAndStatusIn(String queueName, String dedupKey, Collection<JobStatus> statuses);

    boolean existsByQueueNameAndContentDigestAndStatusIn(String queueName, String contentDigest,
                                                         Collection<JobStatus> statuses);

    long countByQueueNameAndStatus(String queueName, JobStatus status);

    boolean existsByImportBatchIdAndStatusIn(String importBatchId, Collection<JobStatus> statuses);

    @Modifying
    @Query("delete from QueueJob j where j.importBatchId = :batchId and j.status in :statuses")
    int deleteByImportBatch(@Param("batchId") String batchId, @Param("statuses") Collection<JobStatus> statuses);

    @Query("""
            select j.id from QueueJob j where j.queueName = :queueName and j.status = :status
            order by j.finishedAt desc""")
    List<Long> findNewestFinishedIds(@Param("queueName") String queueName, @Param("status") JobStatus status,
                                     Pageable pageable);

    @Modifying
    @Query("""
            delete from QueueJob j
            where j.queueName = :queueName and j.status = :status and j.finishedAt < :cutoff
              and j.id not in :keepIds""")
    int deleteFinishedBefore(@Param("queueName") String queueName, @Param("status") JobStatus status,
                             @Param("cutoff") LocalDateTime cutoff, @Param("keepIds") Collection<Long> keepIds);
}
