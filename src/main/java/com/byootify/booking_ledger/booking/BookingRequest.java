package com.byootify.booking_ledger.booking;

import com.byootify.booking_ledger.calendar.TimeInterval;
import com.byootify.booking_ledger.ledger.CurrencyCode;
import lombok.Value;

import java.util.UUID;

@Value
public class BookingRequest {
    UUID clientId;
    UUID providerId;
    TimeInterval interval;
    long servicePrice;
    CurrencyCode currency;
    String paymentMethod;
}
