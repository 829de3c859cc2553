package com.eyelevel.invoiceingestion.service.job;

import com.eyelevel.invoiceingestion.config.IngestionProperties;
import com.eyelevel.invoiceingestion.exception.NotificationDeliveryException;
import com.eyelevel.invoiceingestion.exception.UnrecoverableJobException;
import com.eyelevel.invoiceingestion.model.DeliveryLog;
import com.eyelevel.invoiceingestion.model.DeliveryStatus;
import com.eyelevel.invoiceingestion.repository.DeliveryLogRepository;
import com.eyelevel.invoiceingestion.service.notification.DeliveryErrorClassification;
import com.eyelevel.invoiceingestion.service.notification.DeliveryErrorClassifier;
import com.eyelevel.invoiceingestion.service.notification.DeliveryErrorType;
import com.eyelevel.invoiceingestion.service.notification.NotificationSender;
import com.eyelevel.invoiceingestion.service.notification.OutboundMessage;
import com.eyelevel.invoiceingestion.service.notification.ProviderRateLimiters;
import com.eyelevel.invoiceingestion.service.queue.JobContext;
import com.eyelevel.invoiceingestion.service.queue.JobHandler;
import com.eyelevel.invoiceingestion.service.queue.QueueName;
import com.eyelevel.invoiceingestion.service.queue.payload.EmailPayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Delivers one queued notification under its provider's rate limit. A delivery already marked SENT is never
 * sent again. Permanent rejections end the job without retries; everything else is deferred and retried.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EmailJobHandler implements JobHandler<EmailPayload> {

    private final DeliveryLogRepository deliveryLogRepository;
    private final ProviderRateLimiters rateLimiters;
    private final NotificationSender notificationSender;
    private final DeliveryErrorClassifier errorClassifier;
    private final IngestionProperties properties;

    @Override
    public QueueName queue() {
        return QueueName.EMAIL;
    }

    @Override
    public Class<EmailPayload> payloadType() {
        return EmailPayload.class;
    }

    @Override
    public Object handle(final JobContext context, final EmailPayload payload) {
        final DeliveryLog deliveryLog = deliveryLogRepository.findById(payload.deliveryLogId())
                                                             .orElseThrow(() -> new UnrecoverableJobException(
                                                                     "Delivery log " + payload.deliveryLogId()
                                                                     + " not found"));
        final String logPrefix = "[Delivery: " + deliveryLog.getId() + "]";
        if (deliveryLog.getStatus() == DeliveryStatus.SENT) {
            log.info("{} Already sent. Skipping.", logPrefix);
            return result(deliveryLog, true);
        }

        final String provider = payload.provider() != null ? payload.provider()
                                                           : properties.getNotification().getDefaultProvider();
        deliveryLog.setStatus(DeliveryStatus.SENDING);
        deliveryLog.setAttempts(context.attemptsMade());
        deliveryLog.setProvider(provider);
        deliveryLogRepository.save(deliveryLog);

        try {
            if (!rateLimiters.acquire(provider)) {
                throw new NotificationDeliveryException("Rate limit slot for " + provider + " not acquired in time",
                                                        null, 429);
            }
            final String messageId = notificationSender.send(new OutboundMessage(
                    properties.getNotification().getFromAddress(), payload.recipients(), payload.subject(),
                    payload.body()));
            deliveryLog.setStatus(DeliveryStatus.SENT);
            deliveryLog.setMessageId(messageId);
            deliveryLog.setSentAt(LocalDateTime.now());
            deliveryLog.setLastError(null);
            deliveryLogRepository.save(deliveryLog);
            log.info("{} Sent via {} on attempt {} (message id {}).", logPrefix, provider, context.attemptsMade(),
                     messageId);
            return result(deliveryLog, false);
        } catch (UnrecoverableJobException e) {
            recordFailure(deliveryLog, DeliveryStatus.FAILED_PERMANENT, e.getMessage(), null,
                          DeliveryErrorType.PERMANENT);
            throw e;
        } catch (RuntimeException e) {
            final DeliveryErrorClassification classification = errorClassifier.classify(e);
            final String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            if (classification.type() == DeliveryErrorType.PERMANENT) {
                recordFailure(deliveryLog, DeliveryStatus.FAILED_PERMANENT, message, classification.code(),
                              classification.type());
                log.error("{} Permanent failure ({}): {}", logPrefix, classification.code(), message);
                throw new UnrecoverableJobException("Permanent failure (" + classification.code() + "): " + message,
                                                    e);
            }
            recordFailure(deliveryLog, DeliveryStatus.DEFERRED, message, classification.code(),
                          classification.type());
            log.warn("{} {} failure on attempt {} of {}. Deferring: {}", logPrefix, classification.type(),
                     context.attemptsMade(), context.maxAttempts(), message);
            throw e;
        }
    }

    private void recordFailure(final DeliveryLog deliveryLog, final DeliveryStatus status, final String message,
                               final String code, final DeliveryErrorType type) {
        deliveryLog.setStatus(status);
        deliveryLog.setLastError(truncate(message));
        deliveryLog.setErrorCode(code);
        deliveryLog.setErrorType(type.name());
        deliveryLogRepository.save(deliveryLog);
    }

    static String truncate(final String message) {
        if (message == null || message.length() <= DeliveryLog.MAX_ERROR_LENGTH) {
            return message;
        }
        return message.substring(0, DeliveryLog.MAX_ERROR_LENGTH);
    }

    private static Map<String, Object> result(final DeliveryLog deliveryLog, final boolean alreadySent) {
        final Map<String, Object> result = new LinkedHashMap<>();
        result.put("deliveryLogId", deliveryLog.getId());
        result.put("alreadySent", alreadySent);
        result.put("messageId", deliveryLog.getMessageId());
        result.put("provider", deliveryLog.getProvider());
        return result;
    }
}
