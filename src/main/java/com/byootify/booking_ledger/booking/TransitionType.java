package com.byootify.booking_ledger.booking;

import com.byootify.booking_ledger.fee.FeeEventType;

/**
 * Recorded appointment transitions. TIP does not change state but is priced like one.
 */
public enum TransitionType {
    CONFIRM(AppointmentStatus.CONFIRMED, FeeEventType.CONFIRMED),
    COMPLETE(AppointmentStatus.COMPLETED, FeeEventType.COMPLETED),
    CANCEL(AppointmentStatus.CANCELLED, FeeEventType.CANCELLED),
    NO_SHOW(AppointmentStatus.NO_SHOW, FeeEventType.NO_SHOW),
    TIP(AppointmentStatus.COMPLETED, FeeEventType.TIP);

    private final AppointmentStatus target;
    private final FeeEventType feeEventType;

    TransitionType(AppointmentStatus target, FeeEventType feeEventType) {
        this.target = target;
        this.feeEventType = feeEventType;
    }

    public AppointmentStatus getTarget() {
        return target;
    }

    public FeeEventType getFeeEventType() {
        return feeEventType;
    }
}
