package com.flagship.accounting_ledger.observability;

import com.flagship.accounting_ledger.integrity.LedgerIntegrityMonitor;
import com.flagship.accounting_ledger.outbox.OutboxEventRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Actuator health indicators for the accounting service.
 */
public class HealthIndicators {

    /**
     * DOWN once an integrity violation has been latched. Stays DOWN until restart.
     */
    @Component("ledgerIntegrity")
    public static class LedgerIntegrityHealthIndicator implements HealthIndicator {

        private final LedgerIntegrityMonitor monitor;

        public LedgerIntegrityHealthIndicator(LedgerIntegrityMonitor monitor) {
            this.monitor = monitor;
        }

        @Override
        public Health health() {
            return monitor.getViolation()
                .map(violation -> Health.down()
                    .withDetail("identity", violation.getIdentity())
                    .withDetail("detail", violation.getDetail())
                    .withDetail("detectedAt", violation.getDetectedAt().toString())
                    .withDetail("correctionsHalted", true)
                    .build())
                .orElseGet(() -> Health.up().withDetail("correctionsHalted", false).build());
        }
    }

    /**
     * WARNING once the backlog grows or any ledger event has exhausted its publish attempts,
     * DOWN when the backlog is critical. Downstream ledgers stall in either case.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        static final long BACKLOG_WARNING_THRESHOLD = 1000;
        static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

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
                Map<String, Long> backlog = new TreeMap<>();
                for (Object[] row : outboxRepository.countUnpublishedByAggregateType()) {
                    backlog.put((String) row[0], ((Number) row[1]).longValue());
                }
                long backlogSize = backlog.values().stream().mapToLong(Long::longValue).sum();
                long deadLettered = outboxRepository.countDeadLetters(maxRetries);

                Health.Builder builder;
                if (backlogSize >= BACKLOG_CRITICAL_THRESHOLD) {
                    builder = Health.down();
                } else if (backlogSize >= BACKLOG_WARNING_THRESHOLD || deadLettered > 0) {
                    builder = Health.status("WARNING");
                } else {
                    builder = Health.up();
                }
                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("backlogByAggregateType", backlog)
                        .withDetail("deadLettered", deadLettered)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();
            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }

    /**
     * Redis only backs the client reference fast path, so an outage degrades rather than fails.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private static final String FALLBACK_NOTE = "Client references fall back to the database";

        private final Optional<StringRedisTemplate> redisTemplate;

        public RedisHealthIndicator(Optional<StringRedisTemplate> redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            if (redisTemplate.isEmpty()) {
                return Health.status("DEGRADED")
                        .withDetail("error", "Redis not configured")
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            }
            RedisConnectionFactory connectionFactory = redisTemplate.get().getConnectionFactory();
            if (connectionFactory == null) {
                return Health.status("DEGRADED")
                        .withDetail("error", "No connection factory configured")
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            }
            try (RedisConnection connection = connectionFactory.getConnection()) {
                String result = connection.ping();
                return "PONG".equals(result)
                        ? Health.up().withDetail("response", result).build()
                        : Health.down().withDetail("response", String.valueOf(result)).build();
            } catch (Exception e) {
                return Health.status("DEGRADED")
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            }
        }
    }

    /**
     * Kafka only matters while this instance drains the outbox; without a publisher the
     * status is UNKNOWN rather than DOWN.
     */
    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;
        private final boolean publisherEnabled;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate,
                                    @Value("${outbox.publisher.enabled:true}") boolean publisherEnabled) {
            this.kafkaTemplate = kafkaTemplate;
            this.publisherEnabled = publisherEnabled;
        }

        @Override
        public Health health() {
            if (!publisherEnabled) {
                return Health.unknown()
                        .withDetail("note", "Outbox publisher disabled on this instance")
                        .build();
            }
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
