package com.eyelevel.invoiceingestion.service.notification;

import com.eyelevel.invoiceingestion.config.IngestionProperties;
import com.eyelevel.invoiceingestion.model.DeliveryLog;
import com.eyelevel.invoiceingestion.model.DeliveryStatus;
import com.eyelevel.invoiceingestion.repository.DeliveryLogRepository;
import com.eyelevel.invoiceingestion.service.queue.JobQueueService;
import com.eyelevel.invoiceingestion.service.queue.QueueName;
import com.eyelevel.invoiceingestion.service.queue.payload.EmailPayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Entry point for outbound notifications. A message is logged as PENDING and delivered asynchronously by the
 * email queue, which applies the provider's rate limit and retry policy.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationService {

    static final String EMAIL_JOB = "send-email";

    private final DeliveryLogRepository deliveryLogRepository;
    private final JobQueueService jobQueueService;
    private final IngestionProperties properties;

    @Transactional
    public DeliveryLog queue(final List<String> recipients, final String subject, final String body,
                             final String provider) {
        final String effectiveProvider = provider != null ? provider
                                                          : properties.getNotification().getDefaultProvider();
        final DeliveryLog deliveryLog = deliveryLogRepository.save(DeliveryLog.builder()
                                                                              .recipients(String.join(",", recipients))
                                                                              .subject(subject)
                                                                              .status(DeliveryStatus.PENDING)
                                                                              .provider(effectiveProvider)
                                                                              .build());
        jobQueueService.enqueue(QueueName.EMAIL, EMAIL_JOB,
                                new EmailPayload(deliveryLog.getId(), List.copyOf(recipients), subject, body,
                                                 effectiveProvider),
                                "delivery-" + deliveryLog.getId());
        log.info("[Delivery: {}] Queued '{}' for {} recipient(s) via {}.", deliveryLog.getId(), subject,
                 recipients.size(), effectiveProvider);
        return deliveryLog;
    }
}
