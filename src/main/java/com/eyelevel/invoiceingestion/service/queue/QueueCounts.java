package com.eyelevel.invoiceingestion.service.queue;

public record QueueCounts(String queueName, long waiting, long active, long delayed, long completed, long failed) {
}
