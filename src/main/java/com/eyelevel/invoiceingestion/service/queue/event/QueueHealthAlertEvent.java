package com.eyelevel.invoiceingestion.service.queue.event;

import com.eyelevel.invoiceingestion.service.queue.QueueCounts;

import java.time.LocalDateTime;

/**
 * Raised when a queue backs up or starts failing noticeably faster than on the previous check.
 */
public record QueueHealthAlertEvent(String queueName, String reason, QueueCounts counts, LocalDateTime raisedAt) {
}
