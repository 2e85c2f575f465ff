package com.byootify.booking_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topics owned by this service.
 *
 * notifications: outbound facts for the notification dispatcher, keyed by aggregate id.
 * triggers: inbound completion/no-show/tip/transfer webhooks relayed by upstream systems.
 */
@Configuration
@ConditionalOnProperty(name = "booking.kafka.create-topics", havingValue = "true", matchIfMissing = true)
public class KafkaConfig {

    @Value("${booking.topic.notifications:booking-notifications}")
    private String notificationsTopic;

    @Value("${booking.topic.triggers:booking-triggers}")
    private String triggersTopic;

    @Bean
    public NewTopic notificationsTopic() {
        return TopicBuilder.name(notificationsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic triggersTopic() {
        return TopicBuilder.name(triggersTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
