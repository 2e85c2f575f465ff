package com.byootify.booking_ledger.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Scheduling and lifecycle settings for appointments.
 *
 * <pre>
 * booking:
 *   short-notice-window: 24h
 *   auto-complete-grace: 2h
 *   calendar:
 *     hold-ttl: 10m
 *   ledger-retry:
 *     max-attempts: 5
 * </pre>
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "booking")
public class BookingProperties {

    /**
     * Cancellations closer than this to the appointment start carry a cancellation fee.
     */
    @NotNull
    private Duration shortNoticeWindow = Duration.ofHours(24);

    /**
     * Confirmed appointments are completed automatically once their end plus this grace has passed.
     */
    @NotNull
    private Duration autoCompleteGrace = Duration.ofHours(2);

    @Valid
    private Calendar calendar = new Calendar();

    @Valid
    private LedgerRetry ledgerRetry = new LedgerRetry();

    @Getter
    @Setter
    public static class Calendar {

        /** Lifetime of a tentative hold before the sweep releases it. */
        @NotNull
        private Duration holdTtl = Duration.ofMinutes(10);
    }

    @Getter
    @Setter
    public static class LedgerRetry {

        @Min(1)
        private int maxAttempts = 5;

        @NotNull
        private Duration initialBackoff = Duration.ofMillis(200);

        private double multiplier = 2.0;

        /** PENDING postings younger than this are left to the request thread. */
        @NotNull
        private Duration pendingGrace = Duration.ofMinutes(1);
    }
}
