package com.byootify.booking_ledger.observability;

import com.byootify.booking_ledger.booking.AppointmentTransitionRepository;
import com.byootify.booking_ledger.booking.LedgerStatus;
import com.byootify.booking_ledger.outbox.OutboxEventRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Readiness checks for the booking service.
 */
public class HealthIndicators {

    /**
     * DOWN once the notification backlog passes the critical threshold.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();

                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();

            } catch (Exception e) {
                return Health.down(e).build();
            }
        }
    }

    /**
     * A halted posting needs an operator; degraded ones are retried automatically.
     */
    @Component("ledgerPostingHealth")
    public static class LedgerPostingHealthIndicator implements HealthIndicator {

        private final AppointmentTransitionRepository transitionRepository;

        public LedgerPostingHealthIndicator(AppointmentTransitionRepository transitionRepository) {
            this.transitionRepository = transitionRepository;
        }

        @Override
        public Health health() {
            try {
                long degraded = transitionRepository.countByLedgerStatus(LedgerStatus.DEGRADED);
                long halted = transitionRepository.countByLedgerStatus(LedgerStatus.HALTED);

                Health.Builder builder = halted > 0
                        ? Health.down()
                        : degraded > 0 ? Health.status("DEGRADED") : Health.up();

                return builder
                        .withDetail("degraded", degraded)
                        .withDetail("halted", halted)
                        .build();

            } catch (Exception e) {
                return Health.down(e).build();
            }
        }
    }

    /**
     * Redis only backs the idempotency fast path, so an outage reports DEGRADED rather than DOWN.
     */
    @Component("redisHealth")
    @ConditionalOnProperty(name = "booking.idempotency.redis-enabled", havingValue = "true", matchIfMissing = true)
    public static class RedisHealthIndicator implements HealthIndicator {

        private static final String FALLBACK_NOTE = "Idempotency falls back to the appointments table";

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            var connectionFactory = redisTemplate.getConnectionFactory();
            if (connectionFactory == null) {
                return Health.status("DEGRADED")
                        .withDetail("error", "No connection factory configured")
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            }

            try (var connection = connectionFactory.getConnection()) {
                String result = connection.ping();
                if ("PONG".equals(result)) {
                    return Health.up().withDetail("response", result).build();
                }
                return Health.down()
                        .withDetail("response", result != null ? result : "null")
                        .build();

            } catch (Exception e) {
                return Health.status("DEGRADED")
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            }
        }
    }

    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            try {
                var metrics = kafkaTemplate.metrics();
                if (metrics == null || metrics.isEmpty()) {
                    return Health.down()
                            .withDetail("error", "No Kafka connections established")
                            .build();
                }
                return Health.up()
                        .withDetail("metricsCount", metrics.size())
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }
}
