package com.eyelevel.invoiceingestion.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * A business counterpart that documents are allocated to. Maintained outside the pipeline; only read here.
 */
@Entity
@Table(name = "company", indexes = {
        @Index(name = "idx_company_reference_no", columnList = "reference_no"),
        @Index(name = "idx_company_code", columnList = "code")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Company {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(name = "reference_no")
    private String referenceNo;

    private String code;

    private String email;

    @Builder.Default
    @Column(nullable = false)
    private boolean active = true;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;
}
