package com.flagship.topup_gateway.topup;

import java.util.Optional;

/**
 * Create/read/update access to topup rows.
 *
 * Every method is its own unit of work: there is no transaction spanning
 * calls, so sequencing and compensation belong to the caller. Writes against
 * a missing row throw {@link org.springframework.dao.EmptyResultDataAccessException};
 * other storage failures surface as {@link org.springframework.dao.DataAccessException}.
 */
public interface TopupLedgerGateway {

    /**
     * Inserts a new topup in PENDING status.
     *
     * @param idempotencyKey optional client key; {@code null} when the caller sent none
     */
    Topup createTopup(String cardNumber, long topupAmount, String topupMethod, String idempotencyKey);

    Optional<Topup> findById(long topupId);

    Optional<Topup> findByIdempotencyKey(String idempotencyKey);

    /**
     * Replaces card number, amount and method of an existing topup.
     */
    Topup updateTopup(long topupId, String cardNumber, long topupAmount, String topupMethod);

    /**
     * Amount-only correction, used to undo {@link #updateTopup} after a later step failed.
     */
    Topup updateTopupAmount(long topupId, long topupAmount);

    Topup updateTopupStatus(long topupId, TopupStatus status);

    /**
     * Soft-deletes a live topup.
     */
    Topup trashedTopup(long topupId);

    /**
     * Clears the soft-delete marker of a trashed topup.
     */
    Topup restoreTopup(long topupId);

    /**
     * Removes a trashed topup for good.
     */
    void deleteTopupPermanent(long topupId);

    /**
     * @return number of topups restored
     */
    int restoreAllTopup();

    /**
     * @return number of topups removed
     */
    int deleteAllTopupPermanent();
}
