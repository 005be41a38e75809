package com.flagship.topup_gateway.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.KafkaException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes notifications to Kafka as JSON strings.
 *
 * Waits for the broker acknowledgment so a failed send can be reported to the
 * caller; never retries on its own.
 */
@Component
@Slf4j
public class KafkaNotificationPublisher implements NotificationPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final Duration sendTimeout;

    public KafkaNotificationPublisher(KafkaTemplate<String, String> kafkaTemplate,
                                      ObjectMapper objectMapper,
                                      @Value("${topup.notification.send-timeout:10s}") Duration sendTimeout) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.sendTimeout = sendTimeout;
    }

    @Override
    public void send(String topic, String key, TopupNotification payload) {
        String value = serialize(payload);

        try {
            CompletableFuture<SendResult<String, String>> future = kafkaTemplate.send(topic, key, value);
            SendResult<String, String> result = future.get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);

            log.debug("Published notification: topic={}, key={}, partition={}, offset={}",
                    topic, key,
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NotificationPublishException("Interrupted while publishing to " + topic, e);
        } catch (ExecutionException e) {
            throw new NotificationPublishException("Failed to publish to " + topic, e.getCause());
        } catch (TimeoutException e) {
            throw new NotificationPublishException(
                "Timed out after " + sendTimeout.toMillis() + "ms publishing to " + topic, e);
        } catch (KafkaException e) {
            throw new NotificationPublishException("Kafka rejected message for " + topic, e);
        }
    }

    private String serialize(TopupNotification payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new NotificationPublishException("Failed to serialize notification payload", e);
        }
    }
}
