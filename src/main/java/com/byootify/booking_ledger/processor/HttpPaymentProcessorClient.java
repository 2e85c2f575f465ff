package com.byootify.booking_ledger.processor;

import com.byootify.booking_ledger.exception.PaymentDeclinedException;
import com.byootify.booking_ledger.exception.ProcessorUnavailableException;
import com.byootify.booking_ledger.exception.TransferRejectedException;
import com.byootify.booking_ledger.ledger.CurrencyCode;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Processor client over HTTP/JSON with bounded connect and read timeouts.
 *
 * 402 and 422 responses are definitive refusals; transport errors and 5xx responses surface
 * as {@link ProcessorUnavailableException} so callers retry with the same idempotency key.
 * Transfer statuses the client does not recognise are read as still in flight.
 */
@Component
@ConditionalOnProperty(name = "payment-processor.mode", havingValue = "http")
@Slf4j
public class HttpPaymentProcessorClient implements PaymentProcessorClient {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final RestClient restClient;

    @Autowired
    public HttpPaymentProcessorClient(PaymentProcessorProperties properties, RestClient.Builder builder) {
        this(configure(builder, properties).requestFactory(requestFactory(properties)).build());
    }

    HttpPaymentProcessorClient(RestClient restClient) {
        this.restClient = restClient;
    }

    static RestClient.Builder configure(RestClient.Builder builder, PaymentProcessorProperties properties) {
        RestClient.Builder configured = builder
            .baseUrl(properties.getBaseUrl())
            .defaultHeader("Accept", MediaType.APPLICATION_JSON_VALUE);
        if (StringUtils.hasText(properties.getApiKey())) {
            configured = configured.defaultHeader("Authorization", "Bearer " + properties.getApiKey());
        }
        return configured;
    }

    private static SimpleClientHttpRequestFactory requestFactory(PaymentProcessorProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) properties.getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) properties.getReadTimeout().toMillis());
        return requestFactory;
    }

    @Override
    public String captureHold(long amount, CurrencyCode currency, String paymentMethod, String idempotencyKey) {
        try {
            return post("/v1/holds", idempotencyKey,
                    new MoneyRequest(amount, currency.name(), paymentMethod, null, null)).getId();
        } catch (HttpClientErrorException e) {
            if (isRefusal(e)) {
                throw new PaymentDeclinedException(e.getResponseBodyAsString());
            }
            throw new ProcessorUnavailableException("Hold capture rejected: " + e.getStatusCode(), e);
        }
    }

    @Override
    public String refund(String holdToken, long amount, CurrencyCode currency, String idempotencyKey) {
        return post("/v1/refunds", idempotencyKey,
                new MoneyRequest(amount, currency.name(), null, holdToken, null)).getId();
    }

    @Override
    public String charge(String paymentMethod, long amount, CurrencyCode currency, String idempotencyKey) {
        return post("/v1/charges", idempotencyKey,
                new MoneyRequest(amount, currency.name(), paymentMethod, null, null)).getId();
    }

    @Override
    public String transfer(String providerAccount, long amount, CurrencyCode currency, String idempotencyKey) {
        try {
            return post("/v1/transfers", idempotencyKey,
                    new MoneyRequest(amount, currency.name(), null, null, providerAccount)).getId();
        } catch (HttpClientErrorException e) {
            if (isRefusal(e)) {
                throw new TransferRejectedException(e.getResponseBodyAsString());
            }
            throw new ProcessorUnavailableException("Transfer rejected: " + e.getStatusCode(), e);
        }
    }

    @Override
    public TransferStatus transferStatus(String transferId) {
        try {
            ProcessorResponse response = restClient.get()
                .uri("/v1/transfers/{id}", transferId)
                .retrieve()
                .body(ProcessorResponse.class);
            if (response == null || response.getStatus() == null) {
                throw new ProcessorUnavailableException("Empty transfer status for " + transferId, null);
            }
            return TransferStatus.fromProcessor(response.getStatus());
        } catch (RestClientException e) {
            log.warn("Transfer status lookup failed: transferId={}, error={}", transferId, e.getMessage());
            throw new ProcessorUnavailableException("Transfer status unavailable for " + transferId, e);
        }
    }

    private ProcessorResponse post(String path, String idempotencyKey, MoneyRequest request) {
        try {
            ProcessorResponse response = restClient.post()
                .uri(path)
                .header(IDEMPOTENCY_KEY_HEADER, idempotencyKey)
                .contentType(MediaType.APPLICATION_JSON)
                .body(request)
                .retrieve()
                .body(ProcessorResponse.class);
            if (response == null || response.getId() == null) {
                throw new ProcessorUnavailableException("Empty processor response for " + path, null);
            }
            return response;
        } catch (HttpClientErrorException e) {
            throw e;
        } catch (RestClientException e) {
            log.warn("Processor call failed: path={}, error={}", path, e.getMessage());
            throw new ProcessorUnavailableException("Processor call failed: " + path, e);
        }
    }

    private static boolean isRefusal(HttpClientErrorException e) {
        return e.getStatusCode().value() == HttpStatus.PAYMENT_REQUIRED.value()
            || e.getStatusCode().value() == HttpStatus.UNPROCESSABLE_ENTITY.value();
    }

    @Value
    static class MoneyRequest {
        @JsonProperty("amount_minor")
        long amount;
        String currency;
        @JsonProperty("payment_method")
        String paymentMethod;
        @JsonProperty("hold_token")
        String holdToken;
        @JsonProperty("destination_account")
        String destinationAccount;
    }

    @Value
    static class ProcessorResponse {
        String id;
        String status;
    }
}
