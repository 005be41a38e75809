package com.flagship.topup_gateway.topup.exception;

/**
 * Raised when a compensating write fails after an earlier step already failed.
 *
 * The original failure is the cause and stays available through
 * {@link #getOriginalFailure()}; the failed compensation is attached as a
 * suppressed exception.
 */
public class TopupRollbackException extends TopupException {

    private final TopupException originalFailure;

    public TopupRollbackException(String code, TopupException originalFailure, Throwable rollbackFailure) {
        super(ErrorKind.ROLLBACK_FAILURE, code,
            "Rollback failed after: " + originalFailure.getMessage(), originalFailure);
        this.originalFailure = originalFailure;
        addSuppressed(rollbackFailure);
    }

    public TopupException getOriginalFailure() {
        return originalFailure;
    }
}
