package com.flagship.topup_gateway.topup;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Topup domain object: one request to add funds to a card's saldo.
 *
 * Immutable snapshot of a stored row. Status changes go through the
 * {@link TopupLedgerGateway}; a topup is never deleted by the saga itself.
 */
@Value
public class Topup {
    long id;
    UUID topupNo;
    String cardNumber;
    long topupAmount;
    String topupMethod;
    TopupStatus status;
    Instant topupTime;
    Instant createdAt;
    Instant updatedAt;
    Instant deletedAt;

    public boolean isTrashed() {
        return deletedAt != null;
    }
}
