package com.flagship.topup_gateway.topup.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

/**
 * Correction of an existing topup's amount and method. The saldo is
 * reconciled by the difference to the stored amount.
 */
@Value
public class UpdateTopupRequest {

    @JsonProperty("topup_id")
    Long topupId;

    @NotBlank(message = "Card number is required")
    @JsonProperty("card_number")
    String cardNumber;

    @NotNull(message = "Topup amount is required")
    @Min(value = 1, message = "Topup amount must be greater than 0")
    @JsonProperty("topup_amount")
    Long topupAmount;

    @NotBlank(message = "Topup method is required")
    @JsonProperty("topup_method")
    String topupMethod;

    /**
     * Copy bound to the id taken from the request path.
     */
    public UpdateTopupRequest withTopupId(long id) {
        return new UpdateTopupRequest(id, cardNumber, topupAmount, topupMethod);
    }
}
