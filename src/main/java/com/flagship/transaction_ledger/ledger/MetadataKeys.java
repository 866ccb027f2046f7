package com.flagship.transaction_ledger.ledger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Well-known keys in a transaction's metadata map.
 */
public final class MetadataKeys {

    public static final String AMOUNT = "amount";
    public static final String DESCRIPTION = "description";
    public static final String FROM_CARD_ID = "from_card_id";
    public static final String TO_CARD_ID = "to_card_id";
    public static final String TRANSFER_ID = "transfer_id";
    public static final String FLOW = "flow";
    public static final String PAYMENT_INTENT_ID = "payment_intent_id";
    public static final String CLIENT_SECRET = "client_secret";
    public static final String SESSION_ID = "session_id";
    public static final String CHECKOUT_URL = "checkout_url";
    public static final String GATEWAY_STATUS = "gateway_status";
    public static final String ERROR = "error";
    public static final String CANCEL_REASON = "cancel_reason";

    private MetadataKeys() {
    }

    /**
     * Unmodifiable copy of {@code entries} without null keys or values, in the original
     * order. A null map gives an empty one.
     */
    public static Map<String, String> withoutNulls(Map<String, String> entries) {
        if (entries == null || entries.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, String> copy = new LinkedHashMap<>();
        entries.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, value);
            }
        });
        return Collections.unmodifiableMap(copy);
    }
}
