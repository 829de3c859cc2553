package com.eyelevel.invoiceingestion.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * The persisted outcome of ingesting one physical file.
 * <p>
 * {@code liveDigest} mirrors {@code contentDigest} only while the record is the live original for its
 * content. It is cleared for duplicates, failures and soft-deleted records, and carries a unique constraint
 * so that two concurrent ingestions of the same content cannot both create an original.
 */
@Entity
@Table(name = "document_record",
       uniqueConstraints = @UniqueConstraint(name = "uk_document_live_digest", columnNames = "live_digest"),
       indexes = {
               @Index(name = "idx_document_digest", columnList = "content_digest"),
               @Index(name = "idx_document_file_name", columnList = "file_name")
       })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "file_name", nullable = false)
    private String fileName;

    @Column(name = "content_digest", nullable = false, length = 64)
    private String contentDigest;

    @Column(name = "live_digest", length = 64)
    private String liveDigest;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private DocumentStatus status;

    @Enumerated(EnumType.STRING)
    private DocumentType documentType;

    private Long matchedCompanyId;

    private Long duplicateOfId;

    private Long templateId;

    @Column(columnDefinition = "TEXT")
    private String extractionResult;

    private Integer confidenceScore;

    @Enumerated(EnumType.STRING)
    private FailureReason failureReason;

    @Column(columnDefinition = "TEXT")
    private String errorMessage;

    @Column(length = 1024)
    private String fileLocation;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SourceKind sourceKind;

    private String importBatchId;

    private LocalDateTime deletedAt;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
