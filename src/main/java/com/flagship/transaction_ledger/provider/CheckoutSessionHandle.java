package com.flagship.transaction_ledger.provider;

import lombok.Value;

@Value
public class CheckoutSessionHandle {
    String id;
    String url;
}
