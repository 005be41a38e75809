package com.flagship.topup_gateway.topup.exception;

import lombok.Getter;

/**
 * Typed failure of a topup operation.
 *
 * {@code code} is a stable machine-readable identifier of the failed step
 * (e.g. {@code FAILED_UPDATE_SALDO_BALANCE}). Failures of best-effort
 * compensating writes are attached as suppressed exceptions.
 */
@Getter
public class TopupException extends RuntimeException {

    private final ErrorKind kind;
    private final String code;

    public TopupException(ErrorKind kind, String code, String message) {
        super(message);
        this.kind = kind;
        this.code = code;
    }

    public TopupException(ErrorKind kind, String code, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.code = code;
    }

    public static TopupException notFound(String code, String message) {
        return new TopupException(ErrorKind.NOT_FOUND, code, message);
    }

    public static TopupException persistence(String code, String message, Throwable cause) {
        return new TopupException(ErrorKind.PERSISTENCE_FAILURE, code, message, cause);
    }

    public static TopupException validation(String code, String message, Throwable cause) {
        return new TopupException(ErrorKind.VALIDATION_FAILURE, code, message, cause);
    }

    public static TopupException publish(String code, String message, Throwable cause) {
        return new TopupException(ErrorKind.PUBLISH_FAILURE, code, message, cause);
    }
}
