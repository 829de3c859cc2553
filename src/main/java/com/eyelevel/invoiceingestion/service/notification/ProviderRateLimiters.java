package com.eyelevel.invoiceingestion.service.notification;

import com.eyelevel.invoiceingestion.config.IngestionProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * One rate limiter per mail provider. Each provider gets a fixed number of send slots per refresh period, and
 * the whole allowance is restored at once when a new period starts. Providers without settings share the
 * {@code smtp} limits.
 */
@Slf4j
@Component
public class ProviderRateLimiters {

    static final String FALLBACK_PROVIDER = "smtp";
    static final long DEFAULT_TIMEOUT_MS = 120_000L;

    private static final Map<String, int[]> DEFAULT_LIMITS = Map.of(
            "office365", new int[]{2, 4000},
            "smtp2go", new int[]{40, 1000},
            "smtp", new int[]{3, 4000},
            "resend", new int[]{10, 1000},
            "mailtrap", new int[]{3, 4000});

    private final RateLimiterRegistry registry = RateLimiterRegistry.ofDefaults();
    private final Map<String, RateLimiterConfig> configs = new HashMap<>();

    public ProviderRateLimiters(IngestionProperties properties) {
        DEFAULT_LIMITS.forEach((provider, limit) -> configs.put(provider, config(limit[0], limit[1],
                                                                                 DEFAULT_TIMEOUT_MS)));
        properties.getNotification().getProviders().forEach(
                (provider, limit) -> configs.put(provider.toLowerCase(Locale.ROOT),
                                                 config(limit.getCapacity(), limit.getRefreshPeriodMs(),
                                                        limit.getTimeoutMs())));
        log.info("ProviderRateLimiters initialized with {} provider limit(s): {}", configs.size(), configs.keySet());
    }

    /**
     * Blocks until a send slot for the provider is free or its timeout passes.
     *
     * @return {@code false} if no slot became free in time
     */
    public boolean acquire(final String provider) {
        final boolean acquired = limiterFor(provider).acquirePermission();
        if (!acquired) {
            log.warn("No send slot for provider '{}' within its timeout.", provider);
        }
        return acquired;
    }

    public RateLimiter limiterFor(final String provider) {
        final String key = resolve(provider);
        return registry.rateLimiter(key, configs.get(key));
    }

    String resolve(final String provider) {
        if (provider == null) {
            return FALLBACK_PROVIDER;
        }
        final String key = provider.toLowerCase(Locale.ROOT);
        return configs.containsKey(key) ? key : FALLBACK_PROVIDER;
    }

    private static RateLimiterConfig config(final int capacity, final long refreshPeriodMs, final long timeoutMs) {
        return RateLimiterConfig.custom()
                                .limitForPeriod(capacity)
                                .limitRefreshPeriod(Duration.ofMillis(refreshPeriodMs))
                                .timeoutDuration(Duration.ofMillis(timeoutMs))
                                .build();
    }
}
