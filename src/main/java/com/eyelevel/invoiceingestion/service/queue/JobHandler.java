package com.eyelevel.invoiceingestion.service.queue;

import com.eyelevel.invoiceingestion.service.queue.payload.JobPayload;

/**
 * Processes the jobs of one queue.
 * <p>
 * Throwing {@link com.eyelevel.invoiceingestion.exception.UnrecoverableJobException} fails the job at once;
 * any other exception is retried with exponential backoff until the queue's attempts are used up.
 *
 * @param <P> the payload type of the queue
 */
public interface JobHandler<P extends JobPayload> {

    QueueName queue();

    Class<P> payloadType();

    /**
     * @return the job's return value, serialized to JSON and stored on the completed job
     */
    Object handle(JobContext context, P payload) throws Exception;
}
