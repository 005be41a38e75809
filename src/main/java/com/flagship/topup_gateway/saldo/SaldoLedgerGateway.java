package com.flagship.topup_gateway.saldo;

import java.util.Optional;

/**
 * Point access to per-card balances.
 *
 * The balance is written as an absolute value, not incremented; callers that
 * apply a delta must serialize their read-modify-write per card.
 */
public interface SaldoLedgerGateway {

    Optional<Saldo> findByCardNumber(String cardNumber);

    /**
     * Replaces the card's total balance.
     *
     * @throws org.springframework.dao.EmptyResultDataAccessException if the card has no live saldo row
     */
    Saldo updateSaldoBalance(String cardNumber, long totalBalance);
}
