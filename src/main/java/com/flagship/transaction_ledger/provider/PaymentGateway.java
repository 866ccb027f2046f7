package com.flagship.transaction_ledger.provider;

import com.flagship.transaction_ledger.ledger.CurrencyCode;

import java.math.BigDecimal;
import java.util.Map;

/**
 * External gateway that takes deposits from a payer, either through a payment intent
 * the client confirms itself or through a hosted checkout page.
 *
 * Every method throws {@link ProviderException} when the gateway cannot be reached or
 * is not configured.
 */
public interface PaymentGateway {

    /**
     * Whether credentials are present. An unconfigured gateway rejects every call.
     */
    boolean isConfigured();

    PaymentIntentHandle createPaymentIntent(BigDecimal amount, CurrencyCode currency,
                                            Map<String, String> metadata, String idempotencyKey);

    CheckoutSessionHandle createCheckoutSession(BigDecimal amount, CurrencyCode currency, String successUrl,
                                                String cancelUrl, Map<String, String> metadata,
                                                String idempotencyKey);

    GatewayPaymentStatus retrievePaymentIntent(String paymentIntentId);

    GatewayPaymentStatus retrieveCheckoutSession(String sessionId);
}
