package com.byootify.booking_ledger.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables the background jobs: hold expiry sweep, auto-completion, ledger re-posting,
 * client settlement relay, payout cycle and outbox publishing.
 *
 * Integration tests switch this off and drive the jobs by hand.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "booking.scheduling.enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
