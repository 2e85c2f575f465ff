package com.byootify.booking_ledger.payout;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.ZoneId;

/**
 * Payout sweep settings.
 *
 * <pre>
 * booking:
 *   payout:
 *     cron: "0 0 6 * * *"
 *     zone: UTC
 *     hold-days: 1
 *     minimum-amount: 1
 * </pre>
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "booking.payout")
public class PayoutProperties {

    @NotBlank
    private String cron = "0 0 6 * * *";

    @NotNull
    private ZoneId zone = ZoneId.of("UTC");

    /** Funds become eligible this many days after the day they took effect. */
    @Min(1)
    private int holdDays = 1;

    /** Smallest balance, in minor units, worth a transfer. */
    @Min(1)
    private long minimumAmount = 1;
}
