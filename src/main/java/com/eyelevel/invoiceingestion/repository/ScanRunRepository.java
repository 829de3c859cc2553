package com.eyelevel.invoiceingestion.repository;

import com.eyelevel.invoiceingestion.model.ScanRun;
import com.eyelevel.invoiceingestion.model.SourceKind;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ScanRunRepository extends JpaRepository<ScanRun, Long> {

    Optional<ScanRun> findFirstBySourceKindOrderByStartedAtDesc(SourceKind sourceKind);
}
