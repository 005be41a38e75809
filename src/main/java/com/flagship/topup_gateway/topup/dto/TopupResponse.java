package com.flagship.topup_gateway.topup.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.topup_gateway.topup.Topup;
import com.flagship.topup_gateway.topup.TopupStatus;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.UUID;

/**
 * Topup as returned to callers and kept in the cache.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TopupResponse {

    @JsonProperty("id")
    long id;

    @JsonProperty("topup_no")
    UUID topupNo;

    @JsonProperty("card_number")
    String cardNumber;

    @JsonProperty("topup_amount")
    long topupAmount;

    @JsonProperty("topup_method")
    String topupMethod;

    @JsonProperty("status")
    TopupStatus status;

    @JsonProperty("topup_time")
    Instant topupTime;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    @JsonProperty("deleted_at")
    Instant deletedAt;

    public static TopupResponse from(Topup topup) {
        return TopupResponse.builder()
            .id(topup.getId())
            .topupNo(topup.getTopupNo())
            .cardNumber(topup.getCardNumber())
            .topupAmount(topup.getTopupAmount())
            .topupMethod(topup.getTopupMethod())
            .status(topup.getStatus())
            .topupTime(topup.getTopupTime())
            .createdAt(topup.getCreatedAt())
            .updatedAt(topup.getUpdatedAt())
            .deletedAt(topup.getDeletedAt())
            .build();
    }
}
