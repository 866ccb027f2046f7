package com.flagship.transaction_ledger.transaction.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class ConfirmPaymentRequest {

    /**
     * Payment intent id or checkout session id returned when the deposit was started.
     */
    @NotBlank(message = "Payment reference is required")
    @JsonProperty("payment_intent_id")
    @JsonAlias({"session_id", "reference"})
    private String reference;
}
