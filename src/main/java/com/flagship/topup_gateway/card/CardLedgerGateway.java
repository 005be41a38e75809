package com.flagship.topup_gateway.card;

import java.util.Optional;

/**
 * Point access to card records.
 *
 * Writes throw {@link org.springframework.dao.DataAccessException} on failure.
 * No multi-row transaction is exposed.
 */
public interface CardLedgerGateway {

    /**
     * Finds a live card by number, including the owning user's email.
     */
    Optional<Card> findUserCardByCardNumber(String cardNumber);

    /**
     * Finds a live card by number without joining the owner.
     */
    Optional<Card> findCardByCardNumber(String cardNumber);

    /**
     * Overwrites the card's mutable fields and returns the stored record.
     *
     * @throws org.springframework.dao.EmptyResultDataAccessException if no live card has the given id
     */
    Card updateCard(UpdateCardRequest request);
}
