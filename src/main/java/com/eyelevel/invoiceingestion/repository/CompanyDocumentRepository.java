package com.eyelevel.invoiceingestion.repository;

import com.eyelevel.invoiceingestion.model.CompanyDocument;
import com.eyelevel.invoiceingestion.model.DocumentType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface CompanyDocumentRepository extends JpaRepository<CompanyDocument, Long> {

    Optional<CompanyDocument> findByCompanyIdAndDocumentTypeAndDocumentNumber(Long companyId, DocumentType documentType,
                                                                             String documentNumber);

    Optional<CompanyDocument> findFirstByDocumentRecordId(Long documentRecordId);

    long countByCompanyId(Long companyId);
}
