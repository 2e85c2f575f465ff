package com.byootify.booking_ledger.fee;

import lombok.Value;

/**
 * An appointment lifecycle event the fee policy prices.
 */
@Value
public class FeeEvent {
    FeeEventType type;
    CancellationParty cancelledBy;   // CANCELLED only
    boolean shortNotice;             // CANCELLED only: inside the short-notice window
    long tipAmount;                  // COMPLETED (optional) and TIP

    public static FeeEvent confirmed() {
        return new FeeEvent(FeeEventType.CONFIRMED, null, false, 0);
    }

    public static FeeEvent completed(long tipAmount) {
        return new FeeEvent(FeeEventType.COMPLETED, null, false, tipAmount);
    }

    public static FeeEvent cancelled(CancellationParty cancelledBy, boolean shortNotice) {
        return new FeeEvent(FeeEventType.CANCELLED, cancelledBy, shortNotice, 0);
    }

    public static FeeEvent noShow() {
        return new FeeEvent(FeeEventType.NO_SHOW, null, false, 0);
    }

    public static FeeEvent tip(long tipAmount) {
        return new FeeEvent(FeeEventType.TIP, null, false, tipAmount);
    }

    public boolean chargesCancellationFee() {
        return type == FeeEventType.CANCELLED && cancelledBy == CancellationParty.CLIENT && shortNotice;
    }
}
