package com.eyelevel.invoiceingestion.service.queue.payload;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Deliver one notification. The delivery log row is created at enqueue time and tracks every attempt.
 *
 * @param provider mail provider whose rate limit applies, or {@code null} for the configured default
 */
public record EmailPayload(@NotNull Long deliveryLogId,
                           @NotEmpty List<@NotBlank String> recipients,
                           @NotBlank String subject,
                           String body,
                           String provider) implements JobPayload {
}
