package com.flagship.transaction_ledger.provider.stripe;

import com.flagship.transaction_ledger.ledger.CurrencyCode;
import com.flagship.transaction_ledger.ledger.MetadataKeys;
import com.flagship.transaction_ledger.provider.CardTransferProvider;
import com.flagship.transaction_ledger.provider.CardTransferResult;
import com.flagship.transaction_ledger.provider.ProviderException;
import com.stripe.exception.CardException;
import com.stripe.exception.StripeException;
import com.stripe.model.PaymentIntent;
import com.stripe.param.PaymentIntentCreateParams;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Card-to-card transfers executed as a confirmed, off-session Stripe payment intent
 * charged to the source card's payment method.
 *
 * A decline is a {@link CardTransferResult#failure}; anything else that goes wrong on
 * the way to Stripe is a {@link ProviderException}.
 */
@Component
@Slf4j
public class StripeCardTransferProvider implements CardTransferProvider {

    private final StripeSettings settings;
    private final CurrencyCode currency;

    public StripeCardTransferProvider(StripeSettings settings,
                                      @Value("${ledger.currency:USD}") CurrencyCode currency) {
        this.settings = settings;
        this.currency = currency;
    }

    @Override
    public CardTransferResult createTransfer(String fromCardId, String toCardId, BigDecimal amount,
                                             String idempotencyKey) {
        if (!settings.isConfigured()) {
            throw new ProviderException("Stripe is not configured");
        }

        PaymentIntentCreateParams params = PaymentIntentCreateParams.builder()
                .setAmount(currency.toMinorUnits(amount))
                .setCurrency(currency.gatewayCode())
                .setPaymentMethod(fromCardId)
                .setConfirm(true)
                .setOffSession(true)
                .putMetadata(MetadataKeys.FROM_CARD_ID, fromCardId)
                .putMetadata(MetadataKeys.TO_CARD_ID, toCardId)
                .setAutomaticPaymentMethods(
                    PaymentIntentCreateParams.AutomaticPaymentMethods.builder()
                        .setEnabled(true)
                        .setAllowRedirects(
                            PaymentIntentCreateParams.AutomaticPaymentMethods.AllowRedirects.NEVER)
                        .build())
                .build();

        try {
            PaymentIntent intent = PaymentIntent.create(params, settings.requestOptions(idempotencyKey));
            if (!"succeeded".equals(intent.getStatus())) {
                log.info("Card transfer not completed: intent={}, status={}", intent.getId(), intent.getStatus());
                return CardTransferResult.failure("Transfer not completed, provider status: " + intent.getStatus());
            }

            Map<String, String> data = new LinkedHashMap<>();
            data.put(MetadataKeys.TRANSFER_ID, intent.getId());
            data.put(MetadataKeys.GATEWAY_STATUS, intent.getStatus());
            return CardTransferResult.success(data);

        } catch (CardException e) {
            log.info("Card transfer declined: code={}, declineCode={}", e.getCode(), e.getDeclineCode());
            return CardTransferResult.failure(e.getMessage());
        } catch (StripeException e) {
            throw new ProviderException("Stripe card transfer failed: " + e.getMessage(), e);
        }
    }
}
