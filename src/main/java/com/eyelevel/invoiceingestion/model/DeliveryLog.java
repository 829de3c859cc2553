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
 * Delivery state of one outbound notification. A {@code SENT} log is never sent again.
 */
@Entity
@Table(name = "delivery_log")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeliveryLog {

    public static final int MAX_ERROR_LENGTH = 1000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String recipients;

    private String subject;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private DeliveryStatus status;

    private int attempts;

    private String provider;

    private String messageId;

    @Column(length = MAX_ERROR_LENGTH)
    private String lastError;

    private String errorCode;

    private String errorType;

    private LocalDateTime sentAt;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
