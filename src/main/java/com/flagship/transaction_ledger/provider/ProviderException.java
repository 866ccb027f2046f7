package com.flagship.transaction_ledger.provider;

/**
 * A call to an external provider could not be completed: network failure, timeout,
 * authentication problem or an unexpected response. Distinct from a provider that
 * answered and declined, which is reported as a result rather than thrown.
 */
public class ProviderException extends RuntimeException {

    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
