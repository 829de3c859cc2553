package com.eyelevel.invoiceingestion.model;

import com.eyelevel.invoiceingestion.model.converter.FieldDefinitionsConverter;
import com.eyelevel.invoiceingestion.model.converter.StringListConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A user-defined coordinate template describing where each business field sits on a fixed-layout document.
 * <p>
 * At most one template may be the default for a given (supplier scope, document type, file kind) tuple;
 * {@link com.eyelevel.invoiceingestion.service.template.TemplateService#setAsDefault(Long)} keeps that true.
 */
@Entity
@Table(name = "extraction_template",
       indexes = @Index(name = "idx_template_lookup", columnList = "file_kind, document_type, enabled"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionTemplate {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private String code;

    /**
     * Owning supplier, or {@code null} for a global template.
     */
    private Long supplierId;

    @Enumerated(EnumType.STRING)
    @Column(name = "document_type", nullable = false)
    private DocumentType documentType;

    @Enumerated(EnumType.STRING)
    @Column(name = "file_kind", nullable = false)
    private FileKind fileKind;

    @Column(name = "is_default", nullable = false)
    private boolean defaultTemplate;

    @Builder.Default
    @Column(nullable = false)
    private boolean enabled = true;

    @Builder.Default
    @Column(nullable = false)
    private int priority = 0;

    @Builder.Default
    @Convert(converter = FieldDefinitionsConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, FieldDefinition> fieldDefinitions = new LinkedHashMap<>();

    @Builder.Default
    @Convert(converter = StringListConverter.class)
    @Column(columnDefinition = "TEXT")
    private List<String> mandatoryFields = new ArrayList<>();

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
