package com.flagship.transaction_ledger.provider.stripe;

import com.flagship.transaction_ledger.ledger.CurrencyCode;
import com.flagship.transaction_ledger.provider.CheckoutSessionHandle;
import com.flagship.transaction_ledger.provider.GatewayPaymentStatus;
import com.flagship.transaction_ledger.provider.GatewayPaymentStatus.Outcome;
import com.flagship.transaction_ledger.provider.PaymentGateway;
import com.flagship.transaction_ledger.provider.PaymentIntentHandle;
import com.flagship.transaction_ledger.provider.ProviderException;
import com.stripe.exception.StripeException;
import com.stripe.model.PaymentIntent;
import com.stripe.model.checkout.Session;
import com.stripe.param.PaymentIntentCreateParams;
import com.stripe.param.checkout.SessionCreateParams;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Map;

/**
 * {@link PaymentGateway} backed by Stripe payment intents and Checkout sessions.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StripePaymentGateway implements PaymentGateway {

    static final String DEPOSIT_PRODUCT_NAME = "Account deposit";

    private final StripeSettings settings;

    @Override
    public boolean isConfigured() {
        return settings.isConfigured();
    }

    @Override
    public PaymentIntentHandle createPaymentIntent(BigDecimal amount, CurrencyCode currency,
                                                   Map<String, String> metadata, String idempotencyKey) {
        requireConfigured();
        PaymentIntentCreateParams params = PaymentIntentCreateParams.builder()
                .setAmount(currency.toMinorUnits(amount))
                .setCurrency(currency.gatewayCode())
                .putAllMetadata(metadata)
                .setAutomaticPaymentMethods(
                    PaymentIntentCreateParams.AutomaticPaymentMethods.builder()
                        .setEnabled(true)
                        .build())
                .build();

        try {
            PaymentIntent intent = PaymentIntent.create(params, settings.requestOptions(idempotencyKey));
            log.info("Created Stripe payment intent: id={}, amount={} {}", intent.getId(), amount, currency);
            return new PaymentIntentHandle(intent.getId(), intent.getClientSecret(), intent.getStatus());
        } catch (StripeException e) {
            throw translate("create payment intent", e);
        }
    }

    @Override
    public CheckoutSessionHandle createCheckoutSession(BigDecimal amount, CurrencyCode currency,
                                                       String successUrl, String cancelUrl,
                                                       Map<String, String> metadata,
                                                       String idempotencyKey) {
        requireConfigured();
        SessionCreateParams params = SessionCreateParams.builder()
                .setMode(SessionCreateParams.Mode.PAYMENT)
                .setSuccessUrl(successUrl)
                .setCancelUrl(cancelUrl)
                .putAllMetadata(metadata)
                .setPaymentIntentData(
                    SessionCreateParams.PaymentIntentData.builder()
                        .putAllMetadata(metadata)
                        .build())
                .addLineItem(
                    SessionCreateParams.LineItem.builder()
                        .setQuantity(1L)
                        .setPriceData(
                            SessionCreateParams.LineItem.PriceData.builder()
                                .setCurrency(currency.gatewayCode())
                                .setUnitAmount(currency.toMinorUnits(amount))
                                .setProductData(
                                    SessionCreateParams.LineItem.PriceData.ProductData.builder()
                                        .setName(DEPOSIT_PRODUCT_NAME)
                                        .build())
                                .build())
                        .build())
                .build();

        try {
            Session session = Session.create(params, settings.requestOptions(idempotencyKey));
            log.info("Created Stripe checkout session: id={}, amount={} {}", session.getId(), amount, currency);
            return new CheckoutSessionHandle(session.getId(), session.getUrl());
        } catch (StripeException e) {
            throw translate("create checkout session", e);
        }
    }

    @Override
    public GatewayPaymentStatus retrievePaymentIntent(String paymentIntentId) {
        requireConfigured();
        try {
            PaymentIntent intent = PaymentIntent.retrieve(paymentIntentId, settings.requestOptions());
            String error = intent.getLastPaymentError() != null
                    ? intent.getLastPaymentError().getMessage()
                    : null;
            return new GatewayPaymentStatus(
                intent.getId(),
                intent.getStatus(),
                paymentIntentOutcome(intent.getStatus(), error != null),
                error
            );
        } catch (StripeException e) {
            throw translate("retrieve payment intent", e);
        }
    }

    @Override
    public GatewayPaymentStatus retrieveCheckoutSession(String sessionId) {
        requireConfigured();
        try {
            Session session = Session.retrieve(sessionId, settings.requestOptions());
            return GatewayPaymentStatus.of(
                session.getId(),
                session.getStatus() + "/" + session.getPaymentStatus(),
                checkoutSessionOutcome(session.getStatus(), session.getPaymentStatus())
            );
        } catch (StripeException e) {
            throw translate("retrieve checkout session", e);
        }
    }

    /**
     * "requires_payment_method" is the starting state of every intent; it only means the
     * payment failed when an attempt has been recorded against it.
     */
    static Outcome paymentIntentOutcome(String status, boolean hasPaymentError) {
        if (status == null) {
            return Outcome.IN_PROGRESS;
        }
        return switch (status) {
            case "succeeded" -> Outcome.SUCCEEDED;
            case "canceled" -> Outcome.FAILED;
            case "requires_payment_method" -> hasPaymentError ? Outcome.FAILED : Outcome.IN_PROGRESS;
            default -> Outcome.IN_PROGRESS;
        };
    }

    static Outcome checkoutSessionOutcome(String status, String paymentStatus) {
        if ("paid".equals(paymentStatus) || "no_payment_required".equals(paymentStatus)) {
            return Outcome.SUCCEEDED;
        }
        if ("expired".equals(status)) {
            return Outcome.FAILED;
        }
        return Outcome.IN_PROGRESS;
    }

    private void requireConfigured() {
        if (!settings.isConfigured()) {
            throw new ProviderException("Stripe is not configured");
        }
    }

    private ProviderException translate(String operation, StripeException e) {
        log.warn("Stripe call failed: operation={}, code={}, status={}, requestId={}",
                operation, e.getCode(), e.getStatusCode(), e.getRequestId());
        return new ProviderException("Stripe " + operation + " failed: " + e.getMessage(), e);
    }
}
