package com.eyelevel.invoiceingestion.repository;

import com.eyelevel.invoiceingestion.model.DocumentType;
import com.eyelevel.invoiceingestion.model.ExtractionTemplate;
import com.eyelevel.invoiceingestion.model.FileKind;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Spring Data JPA repository for the {@link ExtractionTemplate} entity. Each finder mirrors one step of the
 * template resolution chain.
 */
@Repository
public interface ExtractionTemplateRepository extends JpaRepository<ExtractionTemplate, Long> {

    Optional<ExtractionTemplate> findFirstByFileKindAndDocumentTypeAndDefaultTemplateTrueAndEnabledTrueOrderByPriorityDescCreatedAtDesc(
            FileKind fileKind, DocumentType documentType);

    Optional<ExtractionTemplate> findFirstByFileKindAndDocumentTypeAndDefaultTemplateFalseAndEnabledTrueOrderByPriorityDescCreatedAtDesc(
            FileKind fileKind, DocumentType documentType);

    Optional<ExtractionTemplate> findFirstByFileKindAndEnabledTrueOrderByDefaultTemplateDescPriorityDescCreatedAtDesc(
            FileKind fileKind);

    @Modifying(clearAutomatically = true)
    @Query("""
            update ExtractionTemplate t set t.defaultTemplate = false
            where t.fileKind = :fileKind and t.documentType = :documentType and t.id <> :keepId
              and ((:supplierId is null and t.supplierId is null) or t.supplierId = :supplierId)""")
    int clearSiblingDefaults(@Param("supplierId") Long supplierId, @Param("documentType") DocumentType documentType,
                             @Param("fileKind") FileKind fileKind, @Param("keepId") Long keepId);
}
