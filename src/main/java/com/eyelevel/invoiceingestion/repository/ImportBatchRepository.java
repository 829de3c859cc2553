package com.eyelevel.invoiceingestion.repository;

import com.eyelevel.invoiceingestion.model.ImportBatch;
import com.eyelevel.invoiceingestion.model.ImportBatchStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface ImportBatchRepository extends JpaRepository<ImportBatch, String> {

    @Modifying(clearAutomatically = true)
    @Query("update ImportBatch b set b.status = :newStatus where b.id = :id and b.status = :expectedStatus")
    int updateStatusIfExpected(@Param("id") String id, @Param("newStatus") ImportBatchStatus newStatus,
                               @Param("expectedStatus") ImportBatchStatus expectedStatus);

    boolean existsByIdAndStatus(String id, ImportBatchStatus status);
}
