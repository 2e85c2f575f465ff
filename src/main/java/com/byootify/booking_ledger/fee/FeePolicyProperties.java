package com.byootify.booking_ledger.fee;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

/**
 * Marketplace fee rates, validated at startup.
 *
 * <pre>
 * booking:
 *   fees:
 *     reservation-hold-rate: 0.25
 *     service-fee-rate: 0.10
 *     commission-rate: 0.15
 *     cancellation-fee-rate: 0.15
 * </pre>
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "booking.fees")
public class FeePolicyProperties {

    /** Share of the price captured from the client when the booking is confirmed. */
    @NotNull
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private BigDecimal reservationHoldRate = new BigDecimal("0.25");

    /** Client-paid platform fee charged at completion. */
    @NotNull
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private BigDecimal serviceFeeRate = new BigDecimal("0.10");

    /** Platform share of the price, withheld from the provider at completion. */
    @NotNull
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private BigDecimal commissionRate = new BigDecimal("0.15");

    /** Fee credited to the provider on a short-notice client cancellation. */
    @NotNull
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private BigDecimal cancellationFeeRate = new BigDecimal("0.15");
}
