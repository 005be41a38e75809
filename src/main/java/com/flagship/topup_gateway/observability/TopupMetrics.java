package com.flagship.topup_gateway.observability;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Per-operation request metrics for the topup service.
 *
 * Metrics exposed:
 * - topup.command.requests: counter tagged with method and status
 * - topup.command.duration: timer tagged with method and status
 * - topup.compensation: counter of compensating writes, tagged with action and outcome
 *
 * Meters are looked up through the injected registry on every call, so
 * building several instances against one registry (tests) never collides.
 */
@Component
public class TopupMetrics {

    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_ERROR = "error";

    private final MeterRegistry registry;

    public TopupMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records one finished request.
     */
    public void recordRequest(String method, String status, long durationNanos) {
        registry.counter("topup.command.requests",
                "method", sanitizeTag(method),
                "status", sanitizeTag(status)
        ).increment();

        Timer.builder("topup.command.duration")
                .tag("method", sanitizeTag(method))
                .tag("status", sanitizeTag(status))
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(Duration.ofNanos(durationNanos));
    }

    /**
     * Records a compensating write (status mark or amount rollback).
     */
    public void recordCompensation(String action, boolean succeeded) {
        registry.counter("topup.compensation",
                "action", sanitizeTag(action),
                "outcome", succeeded ? STATUS_SUCCESS : STATUS_ERROR
        ).increment();
    }

    public void recordCacheLookup(boolean hit) {
        registry.counter("topup.cache", "result", hit ? "hit" : "miss").increment();
    }

    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
