package com.flagship.accounting_ledger.observability;

import com.flagship.accounting_ledger.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Outbox gauges and publish counters.
 *
 * Gauge values are cached and refreshed on a schedule so a Prometheus scrape never hits the
 * database. The backlog is broken down by aggregate type, so a stuck stream of journal entry
 * events is told apart from a stuck stream of account events.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxMetrics {

    private final OutboxEventRepository outboxRepository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final Map<String, AtomicLong> backlogByAggregateType = new ConcurrentHashMap<>();
    private final AtomicLong oldestEventAgeSeconds = new AtomicLong(0);
    private final AtomicLong deadLetterCount = new AtomicLong(0);

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @PostConstruct
    void registerGauges() {
        Gauge.builder("outbox.backlog.age.seconds", oldestEventAgeSeconds, AtomicLong::get)
            .description("Age of the oldest unpublished ledger event in seconds")
            .register(meterRegistry);

        Gauge.builder("outbox.events.dead_letter", deadLetterCount, AtomicLong::get)
            .description("Ledger events that exhausted their publish attempts")
            .register(meterRegistry);
    }

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    @Transactional(readOnly = true)
    public void refreshMetrics() {
        try {
            Set<String> seen = new HashSet<>();
            for (Object[] row : outboxRepository.countUnpublishedByAggregateType()) {
                String aggregateType = (String) row[0];
                seen.add(aggregateType);
                backlogGauge(aggregateType).set(((Number) row[1]).longValue());
            }
            backlogByAggregateType.forEach((type, value) -> {
                if (!seen.contains(type)) {
                    value.set(0);
                }
            });

            oldestEventAgeSeconds.set(outboxRepository.findOldestUnpublishedCreatedAt()
                .map(oldest -> Math.max(0, Duration.between(oldest, Instant.now(clock)).getSeconds()))
                .orElse(0L));
            deadLetterCount.set(outboxRepository.countDeadLetters(maxRetries));

            log.debug("Outbox metrics refreshed: backlog={}, oldestAge={}s, deadLetter={}",
                backlogByAggregateType, oldestEventAgeSeconds.get(), deadLetterCount.get());
        } catch (Exception e) {
            log.warn("Failed to refresh outbox metrics: {}", e.getMessage());
        }
    }

    public void recordEventPublished(String eventType) {
        meterRegistry.counter("outbox.events.published", "event_type", eventType, "status", "success")
            .increment();
    }

    public void recordEventPublishFailed(String eventType) {
        meterRegistry.counter("outbox.events.published", "event_type", eventType, "status", "failure")
            .increment();
    }

    public void recordEventDeadLettered(String eventType) {
        meterRegistry.counter("outbox.events.dead_lettered", "event_type", eventType).increment();
    }

    private AtomicLong backlogGauge(String aggregateType) {
        return backlogByAggregateType.computeIfAbsent(aggregateType, type -> {
            AtomicLong value = new AtomicLong();
            Gauge.builder("outbox.backlog.size", value, AtomicLong::get)
                .description("Unpublished ledger events")
                .tag("aggregate_type", type)
                .register(meterRegistry);
            return value;
        });
    }
}
