package com.eyelevel.invoiceingestion.service.queue.payload;

import jakarta.validation.constraints.NotBlank;

public record ScheduledTaskPayload(@NotBlank String taskName) implements JobPayload {
}
