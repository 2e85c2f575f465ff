package com.byootify.booking_ledger.consumer;

import com.byootify.booking_ledger.booking.BookingService;
import com.byootify.booking_ledger.payout.PayoutService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Applies upstream trigger events. The event id doubles as the trigger id of the resulting
 * appointment transition, so a redelivered event never moves money twice.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TriggerEventHandler {

    private final BookingService bookingService;
    private final PayoutService payoutService;

    public void onAppointmentCompleted(UUID eventId, UUID appointmentId, long tipAmount) {
        log.info("Handling AppointmentCompleted: appointmentId={}, tip={}", appointmentId, tipAmount);
        bookingService.complete(appointmentId, eventId.toString(), tipAmount);
    }

    public void onAppointmentNoShow(UUID eventId, UUID appointmentId) {
        log.info("Handling AppointmentNoShow: appointmentId={}", appointmentId);
        bookingService.markNoShow(appointmentId, eventId.toString());
    }

    public void onTipReceived(UUID eventId, UUID appointmentId, long amount) {
        log.info("Handling TipReceived: appointmentId={}, amount={}", appointmentId, amount);
        bookingService.addTip(appointmentId, eventId.toString(), amount);
    }

    public void onTransferSettled(String transferId) {
        if (payoutService.onTransferSettled(transferId).isEmpty()) {
            log.warn("TransferSettled for unknown transfer {}", transferId);
        }
    }

    public void onTransferFailed(String transferId, String reason) {
        if (payoutService.onTransferFailed(transferId, reason).isEmpty()) {
            log.warn("TransferFailed for unknown transfer {}", transferId);
        }
    }
}
