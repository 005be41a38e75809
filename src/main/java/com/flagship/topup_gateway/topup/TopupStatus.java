package com.flagship.topup_gateway.topup;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Durable outcome marker of a topup.
 *
 * Stored and serialized in lower case ("pending", "success", "failed").
 */
public enum TopupStatus {
    /**
     * Row exists, saga still running.
     */
    PENDING("pending"),

    /**
     * Balance adjusted and card refreshed.
     */
    SUCCESS("success"),

    /**
     * A step failed after the row was created.
     */
    FAILED("failed");

    private final String value;

    TopupStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this != PENDING;
    }

    @JsonCreator
    public static TopupStatus fromValue(String value) {
        return Arrays.stream(values())
            .filter(status -> status.value.equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown topup status: " + value));
    }
}
