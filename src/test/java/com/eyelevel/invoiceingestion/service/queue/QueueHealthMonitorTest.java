package com.eyelevel.invoiceingestion.service.queue;

import com.eyelevel.invoiceingestion.config.IngestionProperties;
import com.eyelevel.invoiceingestion.service.queue.event.QueueHealthAlertEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class QueueHealthMonitorTest {

    @Mock
    private JobQueueService jobQueueService;
    @Mock
    private ApplicationEventPublisher eventPublisher;

    private QueueHealthMonitor monitor;

    @BeforeEach
    void setUp() {
        monitor = new QueueHealthMonitor(jobQueueService, new IngestionProperties(), eventPublisher);
        for (QueueName queue : QueueName.values()) {
            lenient().when(jobQueueService.counts(queue)).thenReturn(counts(queue, 0, 0));
        }
    }

    @Test
    void healthyQueuesRaiseNoAlert() {
        final List<QueueCounts> snapshot = monitor.check();

        assertThat(snapshot).hasSize(QueueName.values().length);
        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }

    @Test
    void waitingBacklogAboveThresholdAlerts() {
        when(jobQueueService.counts(QueueName.INVOICE_IMPORT)).thenReturn(counts(QueueName.INVOICE_IMPORT, 150, 0));

        monitor.check();

        final QueueHealthAlertEvent alert = capturedAlert();
        assertThat(alert.queueName()).isEqualTo("invoice-import");
        assertThat(alert.reason()).isEqualTo("waiting backlog 150 exceeds 100");
    }

    @Test
    void failedGrowthIsMeasuredAgainstPreviousCheck() {
        when(jobQueueService.counts(QueueName.EMAIL)).thenReturn(counts(QueueName.EMAIL, 0, 5))
                                                     .thenReturn(counts(QueueName.EMAIL, 0, 12))
                                                     .thenReturn(counts(QueueName.EMAIL, 0, 30));

        monitor.check();
        monitor.check();
        verify(eventPublisher, never()).publishEvent(any(Object.class));

        monitor.check();
        assertThat(capturedAlert().reason()).isEqualTo("failed jobs grew from 12 to 30");
    }

    @Test
    void oneFailingQueueDoesNotHideTheOthers() {
        when(jobQueueService.counts(QueueName.FILE_IMPORT)).thenThrow(new IllegalStateException("db down"));

        assertThat(monitor.check()).hasSize(QueueName.values().length - 1);
    }

    private QueueHealthAlertEvent capturedAlert() {
        final ArgumentCaptor<Object> event = ArgumentCaptor.forClass(Object.class);
        verify(eventPublisher).publishEvent(event.capture());
        return (QueueHealthAlertEvent) event.getValue();
    }

    private static QueueCounts counts(final QueueName queue, final long waiting, final long failed) {
        return new QueueCounts(queue.getQueueName(), waiting, 0, 0, 0, failed);
    }
}
