package com.flagship.topup_gateway.topup.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

/**
 * Request to add funds to a card's saldo.
 */
@Value
public class CreateTopupRequest {

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
}
