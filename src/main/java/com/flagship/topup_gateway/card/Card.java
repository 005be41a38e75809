package com.flagship.topup_gateway.card;

import lombok.Value;

/**
 * Card record as seen by the topup service.
 *
 * The expire date is kept in its stored "YYYY-MM-DD" text form; callers that
 * need a date parse it themselves. Email is only populated by lookups that
 * join the owning user.
 */
@Value
public class Card {
    long id;
    long userId;
    String cardNumber;
    String cardType;
    String expireDate;
    String cvv;
    String cardProvider;
    String email;
}
