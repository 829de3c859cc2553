package com.eyelevel.invoiceingestion.service.queue;

import com.eyelevel.invoiceingestion.config.IngestionProperties;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * The resolved {@link QueuePolicy} of every queue, computed once at startup.
 */
@Component
public class QueuePolicies {

    private final Map<QueueName, QueuePolicy> policies = new EnumMap<>(QueueName.class);

    public QueuePolicies(IngestionProperties properties) {
        for (QueueName queue : QueueName.values()) {
            policies.put(queue, QueuePolicy.resolve(queue, properties));
        }
    }

    public QueuePolicy policy(QueueName queue) {
        return policies.get(queue);
    }

    public Map<QueueName, QueuePolicy> all() {
        return Collections.unmodifiableMap(policies);
    }
}
