package com.eyelevel.invoiceingestion.service.job;

import com.eyelevel.invoiceingestion.service.pipeline.InvoiceImportPipeline;
import com.eyelevel.invoiceingestion.service.queue.JobContext;
import com.eyelevel.invoiceingestion.service.queue.JobHandler;
import com.eyelevel.invoiceingestion.service.queue.QueueName;
import com.eyelevel.invoiceingestion.service.queue.payload.InvoiceImportPayload;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class InvoiceImportJobHandler implements JobHandler<InvoiceImportPayload> {

    private final InvoiceImportPipeline pipeline;

    @Override
    public QueueName queue() {
        return QueueName.INVOICE_IMPORT;
    }

    @Override
    public Class<InvoiceImportPayload> payloadType() {
        return InvoiceImportPayload.class;
    }

    @Override
    public Object handle(final JobContext context, final InvoiceImportPayload payload) throws Exception {
        return pipeline.run(context, payload);
    }
}
