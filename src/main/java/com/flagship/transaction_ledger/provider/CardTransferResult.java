package com.flagship.transaction_ledger.provider;

import com.flagship.transaction_ledger.ledger.MetadataKeys;
import lombok.Value;

import java.util.Map;

/**
 * Answer from the card network: either accepted with provider data, or declined with a
 * reason.
 */
@Value
public class CardTransferResult {
    boolean success;
    Map<String, String> data;
    String error;

    public static CardTransferResult success(Map<String, String> data) {
        return new CardTransferResult(true, MetadataKeys.withoutNulls(data), null);
    }

    public static CardTransferResult failure(String error) {
        return new CardTransferResult(false, Map.of(), error);
    }
}
