package com.eyelevel.invoiceingestion.service.queue.payload;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * The typed payload of a queued job. Serialized with a {@code type} discriminator so that each queue gets its
 * own record type back at dequeue.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = FileImportPayload.class, name = "file-import"),
        @JsonSubTypes.Type(value = InvoiceImportPayload.class, name = "invoice-import"),
        @JsonSubTypes.Type(value = BulkParsingTestPayload.class, name = "bulk-parsing-test"),
        @JsonSubTypes.Type(value = EmailPayload.class, name = "email"),
        @JsonSubTypes.Type(value = ScheduledTaskPayload.class, name = "scheduled-task")
})
public interface JobPayload {

    /**
     * Import batch the job belongs to, if any. Used for cooperative cancellation.
     */
    default String importBatchId() {
        return null;
    }

    /**
     * Digest of the file the job works on, when it is already known at enqueue time.
     */
    default String contentDigest() {
        return null;
    }
}
