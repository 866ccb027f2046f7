package com.flagship.transaction_ledger.provider.stripe;

import com.stripe.net.RequestOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Stripe credentials and per-request options.
 *
 * The secret key is passed with every request rather than set globally on the SDK, so
 * the key never leaks between application contexts (tests run several).
 */
@Component
@Slf4j
public class StripeSettings {

    private final String secretKey;
    private final int connectTimeoutMs;
    private final int readTimeoutMs;

    public StripeSettings(@Value("${stripe.secret-key:}") String secretKey,
                          @Value("${stripe.connect-timeout-ms:10000}") int connectTimeoutMs,
                          @Value("${stripe.read-timeout-ms:30000}") int readTimeoutMs) {
        this.secretKey = secretKey;
        this.connectTimeoutMs = connectTimeoutMs;
        this.readTimeoutMs = readTimeoutMs;
        if (!isConfigured()) {
            log.warn("stripe.secret-key is not set; deposits will be rejected until it is configured");
        }
    }

    public boolean isConfigured() {
        return secretKey != null && !secretKey.isBlank();
    }

    RequestOptions requestOptions() {
        return requestOptions(null);
    }

    RequestOptions requestOptions(String idempotencyKey) {
        RequestOptions.RequestOptionsBuilder builder = RequestOptions.builder()
                .setApiKey(secretKey)
                .setConnectTimeout(connectTimeoutMs)
                .setReadTimeout(readTimeoutMs);
        if (idempotencyKey != null) {
            builder.setIdempotencyKey(idempotencyKey);
        }
        return builder.build();
    }
}
