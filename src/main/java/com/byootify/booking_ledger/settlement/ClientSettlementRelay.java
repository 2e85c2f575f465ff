package com.byootify.booking_ledger.settlement;

import com.byootify.booking_ledger.exception.PaymentDeclinedException;
import com.byootify.booking_ledger.observability.BookingMetrics;
import com.byootify.booking_ledger.observability.CorrelationContext;
import com.byootify.booking_ledger.processor.PaymentProcessorClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Background relay that hands pending client refunds and charges to the processor.
 *
 * Each instruction is sent with its instruction key as the processor idempotency key, so a
 * crash between the processor call and {@code markSent} is safe to retry.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ClientSettlementRelay {

    private final ClientSettlementService settlementService;
    private final PaymentProcessorClient processorClient;
    private final BookingMetrics bookingMetrics;

    @Value("${booking.settlement.batch-size:50}")
    private int batchSize;

    @Scheduled(fixedDelayString = "${booking.settlement.relay-interval-ms:5000}")
    public void relayPending() {
        try {
            relayOnce();
        } catch (Exception e) {
            log.error("Error in client settlement relay loop", e);
        }
    }

    /**
     * Relays one batch synchronously.
     *
     * @return number of instructions sent
     */
    public int relayOnce() {
        List<ClientSettlement> pending = settlementService.findPending(batchSize);
        int sent = 0;
        for (ClientSettlement settlement : pending) {
            if (relay(settlement)) {
                sent++;
            }
        }
        return sent;
    }

    private boolean relay(ClientSettlement settlement) {
        MDC.put(CorrelationContext.APPOINTMENT_ID_MDC_KEY, settlement.getAppointmentId().toString());
        try {
            String reference = switch (settlement.getType()) {
                case REFUND -> processorClient.refund(settlement.getHoldToken(), settlement.getAmount(),
                        settlement.getCurrency(), settlement.getInstructionKey());
                case CHARGE -> processorClient.charge(settlement.getPaymentMethod(), settlement.getAmount(),
                        settlement.getCurrency(), settlement.getInstructionKey());
            };
            settlementService.markSent(settlement.getId(), reference);
            bookingMetrics.recordClientSettlement(settlement.getType().name(), "sent");
            log.debug("Client settlement sent: id={}, type={}, amount={}",
                    settlement.getId(), settlement.getType(), settlement.getAmount());
            return true;
        } catch (PaymentDeclinedException e) {
            settlementService.markFailed(settlement.getId(), e.getMessage());
            bookingMetrics.recordClientSettlement(settlement.getType().name(), "declined");
            return false;
        } catch (Exception e) {
            settlementService.markAttemptFailed(settlement.getId(), e.getMessage());
            bookingMetrics.recordClientSettlement(settlement.getType().name(), "error");
            return false;
        } finally {
            MDC.remove(CorrelationContext.APPOINTMENT_ID_MDC_KEY);
        }
    }
}
