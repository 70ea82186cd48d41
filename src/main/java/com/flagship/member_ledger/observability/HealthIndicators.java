package com.flagship.member_ledger.observability;

import com.flagship.member_ledger.ledger.LedgerService;
import com.flagship.member_ledger.outbox.OutboxEventRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicators of the member ledger.
 *
 * Only the ledger check can take the service down on its own: a persona whose balance
 * no longer matches its finance log needs a person to look at it. Redis and Kafka
 * problems degrade the service, bookings keep working.
 */
public class HealthIndicators {

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    /**
     * Finance events waiting for Kafka. The association books a few hundred events per
     * billing run, so a backlog in the thousands means the publisher is stuck.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        static final long BACKLOG_WARNING_THRESHOLD = 500;
        static final long BACKLOG_CRITICAL_THRESHOLD = 5000;

        private final OutboxEventRepository outboxRepository;
        private final int maxRetries;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository,
                                     @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
            this.outboxRepository = outboxRepository;
            this.maxRetries = maxRetries;
        }

        @Override
        public Health health() {
            try {
                long pending = outboxRepository.countUnpublished();
                long stuck = outboxRepository.countByRetryCountGreaterThanEqual(maxRetries);

                Health.Builder builder;
                if (pending >= BACKLOG_CRITICAL_THRESHOLD) {
                    builder = Health.down();
                } else if (pending >= BACKLOG_WARNING_THRESHOLD || stuck > 0) {
                    builder = Health.status("WARNING");
                } else {
                    builder = Health.up();
                }
                return builder
                        .withDetail("pendingEvents", pending)
                        .withDetail("stuckEvents", stuck)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();
            } catch (Exception e) {
                return Health.down().withDetail("error", describe(e)).build();
            }
        }
    }

    /**
     * Personas whose balance differs from the last logged new_balance.
     */
    @Component("ledgerHealth")
    public static class LedgerHealthIndicator implements HealthIndicator {

        private final LedgerService ledgerService;

        public LedgerHealthIndicator(LedgerService ledgerService) {
            this.ledgerService = ledgerService;
        }

        @Override
        public Health health() {
            try {
                long inconsistent = ledgerService.countInconsistentPersonas();
                return (inconsistent == 0 ? Health.up() : Health.down())
                        .withDetail("inconsistentPersonas", inconsistent)
                        .build();
            } catch (Exception e) {
                return Health.down().withDetail("error", describe(e)).build();
            }
        }
    }

    /**
     * Redis only speeds up Idempotency-Key lookups for money transfers.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private static final String FALLBACK_NOTE = "Idempotency keys fall back to money_transfer_requests";

        private final RedisConnectionFactory connectionFactory;

        public RedisHealthIndicator(RedisConnectionFactory connectionFactory) {
            this.connectionFactory = connectionFactory;
        }

        @Override
        public Health health() {
            try (RedisConnection connection = connectionFactory.getConnection()) {
                String reply = connection.ping();
                if ("PONG".equals(reply)) {
                    return Health.up().build();
                }
                return Health.status("DEGRADED")
                        .withDetail("response", String.valueOf(reply))
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            } catch (Exception e) {
                return Health.status("DEGRADED")
                        .withDetail("error", describe(e))
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            }
        }
    }

    /**
     * Producer side of finance-events. Without a broker the outbox simply fills up.
     */
    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;
        private final String financeEventsTopic;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate,
                                    @Value("${kafka.topic.finance-events:finance-events}") String financeEventsTopic) {
            this.kafkaTemplate = kafkaTemplate;
            this.financeEventsTopic = financeEventsTopic;
        }

        @Override
        public Health health() {
            try {
                var metrics = kafkaTemplate.metrics();
                if (metrics == null || metrics.isEmpty()) {
                    return Health.status("DEGRADED")
                            .withDetail("topic", financeEventsTopic)
                            .withDetail("error", "No producer connection established yet")
                            .build();
                }
                return Health.up()
                        .withDetail("topic", financeEventsTopic)
                        .withDetail("producerMetrics", metrics.size())
                        .build();
            } catch (Exception e) {
                return Health.status("DEGRADED")
                        .withDetail("topic", financeEventsTopic)
                        .withDetail("error", describe(e))
                        .build();
            }
        }
    }
}
