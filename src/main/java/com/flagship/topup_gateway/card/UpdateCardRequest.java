package com.flagship.topup_gateway.card;

import lombok.Value;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Full replacement of a card's mutable fields.
 */
@Value
public class UpdateCardRequest {
    long cardId;
    long userId;
    String cardType;
    LocalDate expireDate;
    String cvv;
    String cardProvider;

    /**
     * Re-save request carrying the card's current values unchanged.
     */
    public static UpdateCardRequest refreshOf(Card card, LocalDate expireDate) {
        Objects.requireNonNull(card, "card");
        Objects.requireNonNull(expireDate, "expireDate");
        return new UpdateCardRequest(
            card.getId(),
            card.getUserId(),
            card.getCardType(),
            expireDate,
            card.getCvv(),
            card.getCardProvider()
        );
    }
}
