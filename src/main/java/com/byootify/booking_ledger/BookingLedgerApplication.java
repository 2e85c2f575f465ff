package com.byootify.booking_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the appointment scheduling and commission ledger service.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class BookingLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(BookingLedgerApplication.class, args);
    }
}
