package com.byootify.booking_ledger.config;

import com.byootify.booking_ledger.exception.InvariantViolationException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Retry policies for internal side effects of record.
 *
 * Only infrastructure failures are retried. Invariant violations are bugs and halt
 * the appointment immediately.
 */
@Configuration
public class ResilienceConfig {

    public static final String LEDGER_POSTING_RETRY = "ledgerPosting";

    @Bean
    public RetryRegistry retryRegistry() {
        return RetryRegistry.ofDefaults();
    }

    @Bean
    public Retry ledgerPostingRetry(RetryRegistry registry, BookingProperties properties) {
        BookingProperties.LedgerRetry settings = properties.getLedgerRetry();
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(settings.getMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        settings.getInitialBackoff().toMillis(), settings.getMultiplier()))
                .ignoreExceptions(InvariantViolationException.class)
                .build();
        return registry.retry(LEDGER_POSTING_RETRY, config);
    }
}
