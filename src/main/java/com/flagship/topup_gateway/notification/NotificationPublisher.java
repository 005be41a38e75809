package com.flagship.topup_gateway.notification;

/**
 * Hands an outcome event to the message broker.
 *
 * At-least-once, fire-and-forget from the caller's point of view: nothing is
 * retried here, a failed hand-off is reported and left to the caller.
 */
public interface NotificationPublisher {

    /**
     * @throws NotificationPublishException if the broker did not accept the message
     */
    void send(String topic, String key, TopupNotification payload);
}
