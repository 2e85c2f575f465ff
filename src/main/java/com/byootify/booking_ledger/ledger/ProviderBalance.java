package com.byootify.booking_ledger.ledger;

import lombok.Value;

import java.util.UUID;

@Value
public class ProviderBalance {
    UUID providerId;
    CurrencyCode currency;
    long amount;
}
