package com.flagship.topup_gateway.topup.exception;

/**
 * Failure categories reported by topup operations.
 */
public enum ErrorKind {
    /**
     * Card, saldo or topup missing.
     */
    NOT_FOUND,

    /**
     * Stored data could not be interpreted (e.g. an unparseable expire date).
     */
    VALIDATION_FAILURE,

    /**
     * A gateway write or read failed.
     */
    PERSISTENCE_FAILURE,

    /**
     * The outcome event could not be handed to the broker. Financial state is
     * already final; the caller may re-send.
     */
    PUBLISH_FAILURE,

    /**
     * A compensating write failed. Always reported together with the original cause.
     */
    ROLLBACK_FAILURE
}
