package com.eyelevel.invoiceingestion.repository;

import com.eyelevel.invoiceingestion.model.WorkerHeartbeat;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface WorkerHeartbeatRepository extends JpaRepository<WorkerHeartbeat, String> {
}
