package com.eyelevel.invoiceingestion.repository;

import com.eyelevel.invoiceingestion.model.DeadLetterRecord;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface DeadLetterRecordRepository extends JpaRepository<DeadLetterRecord, Long> {

    Page<DeadLetterRecord> findAllByOrderByFailedAtDesc(Pageable pageable);

    Page<DeadLetterRecord> findByOriginalQueueOrderByFailedAtDesc(String originalQueue, Pageable pageable);

    Optional<DeadLetterRecord> findFirstByOriginalQueueAndOriginalJobId(String originalQueue, Long originalJobId);
}
