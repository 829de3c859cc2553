package com.eyelevel.invoiceingestion.service.job;

import com.eyelevel.invoiceingestion.config.IngestionProperties;
import com.eyelevel.invoiceingestion.exception.NotificationDeliveryException;
import com.eyelevel.invoiceingestion.exception.UnrecoverableJobException;
import com.eyelevel.invoiceingestion.model.DeliveryLog;
import com.eyelevel.invoiceingestion.model.DeliveryStatus;
import com.eyelevel.invoiceingestion.repository.DeliveryLogRepository;
import com.eyelevel.invoiceingestion.service.notification.DeliveryErrorClassifier;
import com.eyelevel.invoiceingestion.service.notification.NotificationSender;
import com.eyelevel.invoiceingestion.service.notification.OutboundMessage;
import com.eyelevel.invoiceingestion.service.notification.ProviderRateLimiters;
import com.eyelevel.invoiceingestion.service.queue.JobContext;
import com.eyelevel.invoiceingestion.service.queue.QueueName;
import com.eyelevel.invoiceingestion.service.queue.payload.EmailPayload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EmailJobHandlerTest {

    @Mock
    private DeliveryLogRepository deliveryLogRepository;
    @Mock
    private ProviderRateLimiters rateLimiters;
    @Mock
    private NotificationSender notificationSender;

    private EmailJobHandler handler;
    private DeliveryLog deliveryLog;
    private final EmailPayload payload = new EmailPayload(21L, List.of("ap@globex.example"), "Invoice received",
                                                          "body", null);

    @BeforeEach
    void setUp() {
        final IngestionProperties properties = new IngestionProperties();
        properties.getNotification().setDefaultProvider("office365");
        properties.getNotification().setFromAddress("noreply@acme.example");
        handler = new EmailJobHandler(deliveryLogRepository, rateLimiters, notificationSender,
                                      new DeliveryErrorClassifier(), properties);
        deliveryLog = DeliveryLog.builder().id(21L).status(DeliveryStatus.PENDING).build();
        lenient().when(deliveryLogRepository.findById(21L)).thenReturn(Optional.of(deliveryLog));
    }

    @Test
    @SuppressWarnings("unchecked")
    void sendsUnderDefaultProviderAndMarksSent() {
        when(rateLimiters.acquire("office365")).thenReturn(true);
        when(notificationSender.send(any())).thenReturn("<msg-1@acme>");

        final Map<String, Object> result = (Map<String, Object>) handler.handle(context(2), payload);

        assertThat(deliveryLog.getStatus()).isEqualTo(DeliveryStatus.SENT);
        assertThat(deliveryLog.getAttempts()).isEqualTo(2);
        assertThat(deliveryLog.getSentAt()).isNotNull();
        assertThat(result).containsEntry("messageId", "<msg-1@acme>").containsEntry("alreadySent", false);
        final ArgumentCaptor<OutboundMessage> message = ArgumentCaptor.forClass(OutboundMessage.class);
        verify(notificationSender).send(message.capture());
        assertThat(message.getValue().from()).isEqualTo("noreply@acme.example");
    }

    @Test
    @SuppressWarnings("unchecked")
    void alreadySentDeliveryIsNeverResent() {
        deliveryLog.setStatus(DeliveryStatus.SENT);

        final Map<String, Object> result = (Map<String, Object>) handler.handle(context(1), payload);

        assertThat(result).containsEntry("alreadySent", true);
        verifyNoInteractions(notificationSender, rateLimiters);
    }

    @Test
    void rateLimitTimeoutDefersForRetry() {
        when(rateLimiters.acquire("office365")).thenReturn(false);

        assertThatThrownBy(() -> handler.handle(context(1), payload))
                .isInstanceOf(NotificationDeliveryException.class);

        assertThat(deliveryLog.getStatus()).isEqualTo(DeliveryStatus.DEFERRED);
        assertThat(deliveryLog.getErrorType()).isEqualTo("RATE_LIMITED");
        verify(notificationSender, never()).send(any());
    }

    @Test
    void permanentRejectionEndsTheJob() {
        when(rateLimiters.acquire("office365")).thenReturn(true);
        when(notificationSender.send(any()))
                .thenThrow(new NotificationDeliveryException("550 5.1.1 user unknown", null, 550));

        assertThatThrownBy(() -> handler.handle(context(1), payload))
                .isInstanceOf(UnrecoverableJobException.class)
                .hasMessage("Permanent failure (550): 550 5.1.1 user unknown");

        assertThat(deliveryLog.getStatus()).isEqualTo(DeliveryStatus.FAILED_PERMANENT);
        assertThat(deliveryLog.getErrorCode()).isEqualTo("550");
    }

    @Test
    void transientFailureIsRethrownForRetry() {
        final NotificationDeliveryException failure = new NotificationDeliveryException("socket hang up",
                                                                                        "ECONNRESET", null);
        when(rateLimiters.acquire("office365")).thenReturn(true);
        when(notificationSender.send(any())).thenThrow(failure);

        assertThatThrownBy(() -> handler.handle(context(1), payload)).isSameAs(failure);

        assertThat(deliveryLog.getStatus()).isEqualTo(DeliveryStatus.DEFERRED);
        assertThat(deliveryLog.getErrorCode()).isEqualTo("ECONNRESET");
    }

    @Test
    void unknownDeliveryLogFailsPermanently() {
        final EmailPayload orphan = new EmailPayload(99L, List.of("a@b.example"), "s", "b", "smtp");

        assertThatThrownBy(() -> handler.handle(context(1), orphan)).isInstanceOf(UnrecoverableJobException.class);
    }

    @Test
    void truncatesLongErrors() {
        assertThat(EmailJobHandler.truncate("x".repeat(1500))).hasSize(DeliveryLog.MAX_ERROR_LENGTH);
        assertThat(EmailJobHandler.truncate("short")).isEqualTo("short");
    }

    private static JobContext context(final int attempt) {
        return new JobContext(1L, QueueName.EMAIL, "send-email", attempt, 10, null);
    }
}
