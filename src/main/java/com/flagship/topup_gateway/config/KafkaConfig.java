package com.flagship.topup_gateway.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Declares the topic the topup e-mail notifications go to.
 */
@Configuration
public class KafkaConfig {

    @Value("${topup.notification.topic:email-service-topic-topup-create}")
    private String notificationTopic;

    @Bean
    public NewTopic topupNotificationTopic() {
        return TopicBuilder.name(notificationTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
