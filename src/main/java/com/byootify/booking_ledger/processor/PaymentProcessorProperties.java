package com.byootify.booking_ledger.processor;

import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Payment processor connection settings.
 *
 * <pre>
 * payment-processor:
 *   mode: sandbox          # sandbox | http
 *   base-url: https://processor.internal
 *   connect-timeout: 2s
 *   read-timeout: 5s
 * </pre>
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "payment-processor")
public class PaymentProcessorProperties {

    private String mode = "sandbox";

    private String baseUrl = "http://localhost:8089";

    private String apiKey;

    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(2);

    @NotNull
    private Duration readTimeout = Duration.ofSeconds(5);
}
