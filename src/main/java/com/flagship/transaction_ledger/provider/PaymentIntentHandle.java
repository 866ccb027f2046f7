package com.flagship.transaction_ledger.provider;

import lombok.Value;

@Value
public class PaymentIntentHandle {
    String id;
    String clientSecret;
    String status;
}
