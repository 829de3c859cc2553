package com.eyelevel.invoiceingestion.service.source;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.stereotype.Component;

@Component("remoteTransferRetryListener")
@Slf4j
public class RemoteTransferRetryListener implements RetryListener {
    @Override
    public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback, Throwable throwable) {
        log.warn("Remote transfer operation failed on attempt {}: {}", context.getRetryCount(), throwable.getMessage());
    }
}
