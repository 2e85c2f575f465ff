package com.byootify.booking_ledger.settlement;

import com.byootify.booking_ledger.ledger.CurrencyCode;
import lombok.Value;

import java.util.UUID;

@Value
public class ClientSettlement {
    UUID id;
    UUID appointmentId;
    String instructionKey;
    SettlementType type;
    long amount;
    CurrencyCode currency;
    String holdToken;
    String paymentMethod;
    SettlementStatus status;
    int attempts;
    String lastError;
    String processorReference;
}
