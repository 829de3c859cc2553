package com.eyelevel.invoiceingestion.service.notification;

import com.eyelevel.invoiceingestion.config.IngestionProperties;
import com.eyelevel.invoiceingestion.model.DeliveryLog;
import com.eyelevel.invoiceingestion.model.DeliveryStatus;
import com.eyelevel.invoiceingestion.repository.DeliveryLogRepository;
import com.eyelevel.invoiceingestion.service.queue.JobQueueService;
import com.eyelevel.invoiceingestion.service.queue.QueueName;
import com.eyelevel.invoiceingestion.service.queue.payload.EmailPayload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NotificationServiceTest {

    @Mock
    private DeliveryLogRepository deliveryLogRepository;
    @Mock
    private JobQueueService jobQueueService;

    private NotificationService notificationService;

    @BeforeEach
    void setUp() {
        final IngestionProperties properties = new IngestionProperties();
        properties.getNotification().setDefaultProvider("smtp2go");
        notificationService = new NotificationService(deliveryLogRepository, jobQueueService, properties);
        when(deliveryLogRepository.save(any(DeliveryLog.class))).thenAnswer(invocation -> {
            final DeliveryLog saved = invocation.getArgument(0);
            saved.setId(31L);
            return saved;
        });
    }

    @Test
    void logsPendingDeliveryAndQueuesIt() {
        final DeliveryLog deliveryLog = notificationService.queue(List.of("ap@globex.example", "cfo@globex.example"),
                                                                  "Invoice received", "body", null);

        assertThat(deliveryLog.getStatus()).isEqualTo(DeliveryStatus.PENDING);
        assertThat(deliveryLog.getRecipients()).isEqualTo("ap@globex.example,cfo@globex.example");
        assertThat(deliveryLog.getProvider()).isEqualTo("smtp2go");
        verify(jobQueueService).enqueue(QueueName.EMAIL, NotificationService.EMAIL_JOB,
                                        new EmailPayload(31L, List.of("ap@globex.example", "cfo@globex.example"),
                                                         "Invoice received", "body", "smtp2go"),
                                        "delivery-31");
    }

    @Test
    void explicitProviderWins() {
        final DeliveryLog deliveryLog = notificationService.queue(List.of("a@b.example"), "s", "b", "resend");

        assertThat(deliveryLog.getProvider()).isEqualTo("resend");
    }
}
