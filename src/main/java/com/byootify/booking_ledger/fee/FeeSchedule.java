package com.byootify.booking_ledger.fee;

import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * The rates in effect for one appointment, snapshotted when it is confirmed.
 *
 * Amounts are {@code round_half_even(price * rate)} in minor units.
 */
@Value
public class FeeSchedule {
    BigDecimal reservationHoldRate;
    BigDecimal serviceFeeRate;
    BigDecimal commissionRate;
    BigDecimal cancellationFeeRate;

    public static FeeSchedule from(FeePolicyProperties properties) {
        return new FeeSchedule(
            properties.getReservationHoldRate(),
            properties.getServiceFeeRate(),
            properties.getCommissionRate(),
            properties.getCancellationFeeRate()
        );
    }

    public long holdAmount(long price) {
        return applyRate(price, reservationHoldRate);
    }

    public long serviceFee(long price) {
        return applyRate(price, serviceFeeRate);
    }

    public long commission(long price) {
        return applyRate(price, commissionRate);
    }

    public long cancellationFee(long price) {
        return applyRate(price, cancellationFeeRate);
    }

    static long applyRate(long price, BigDecimal rate) {
        return BigDecimal.valueOf(price)
            .multiply(rate)
            .setScale(0, RoundingMode.HALF_EVEN)
            .longValueExact();
    }
}
