package com.flagship.accounting_ledger.outbox;

import com.flagship.accounting_ledger.observability.CorrelationContext;
import com.flagship.accounting_ledger.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drains the outbox to the ledger topic.
 *
 * Records are keyed by aggregate id, so every event of one journal entry or account lands on
 * one partition in commit order. Each send is acknowledged before the event is marked
 * published; an event that keeps failing stops being selected once it reaches the retry limit
 * and is counted as dead-lettered. Delivery is at-least-once: consumers deduplicate on the
 * {@code event-id} header.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    static final String EVENT_ID_HEADER = "event-id";
    static final String EVENT_TYPE_HEADER = "event-type";
    static final String AGGREGATE_TYPE_HEADER = "aggregate-type";

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.ledger:accounting.ledger}")
    private String ledgerTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Value("${outbox.publisher.send-timeout-ms:10000}")
    private long sendTimeoutMs;

    @Scheduled(fixedDelayString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        List<OutboxEvent> events;
        try {
            events = outboxService.findUnpublishedEvents(batchSize, maxRetries);
        } catch (Exception e) {
            log.error("Could not read pending ledger events from the outbox", e);
            return;
        }
        if (events.isEmpty()) {
            return;
        }

        log.debug("Publishing {} ledger events", events.size());
        for (OutboxEvent event : events) {
            publishEvent(event);
        }
    }

    void publishEvent(OutboxEvent event) {
        try {
            RecordMetadata metadata = kafkaTemplate.send(toRecord(event))
                .get(sendTimeoutMs, TimeUnit.MILLISECONDS)
                .getRecordMetadata();

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());
            log.debug("Published {} for {} {} to {}-{}@{}", event.getEventType(), event.getAggregateType(),
                event.getAggregateId(), metadata.topic(), metadata.partition(), metadata.offset());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordFailure(event, "Interrupted while publishing");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            recordFailure(event, cause.getMessage());
        } catch (TimeoutException e) {
            recordFailure(event, "No acknowledgement within " + sendTimeoutMs + "ms");
        } catch (RuntimeException e) {
            recordFailure(event, e.getMessage());
        }
    }

    private ProducerRecord<String, String> toRecord(OutboxEvent event) {
        ProducerRecord<String, String> record =
            new ProducerRecord<>(ledgerTopic, event.getAggregateId(), event.getPayload());
        addHeader(record, EVENT_ID_HEADER, event.getId().toString());
        addHeader(record, EVENT_TYPE_HEADER, event.getEventType());
        addHeader(record, AGGREGATE_TYPE_HEADER, event.getAggregateType());
        if (event.getCorrelationId() != null) {
            addHeader(record, CorrelationContext.CORRELATION_ID_HEADER, event.getCorrelationId());
        }
        return record;
    }

    private static void addHeader(ProducerRecord<String, String> record, String name, String value) {
        record.headers().add(name, value.getBytes(StandardCharsets.UTF_8));
    }

    private void recordFailure(OutboxEvent event, String error) {
        log.error("Failed to publish {} for {} {} (attempt {}): {}", event.getEventType(),
            event.getAggregateType(), event.getAggregateId(), event.getRetryCount() + 1, error);
        outboxService.markFailed(event.getId(), error);
        outboxMetrics.recordEventPublishFailed(event.getEventType());

        if (event.isLastAttempt(maxRetries)) {
            log.warn("Event {} ({} for {} {}) exhausted {} attempts and will not be retried automatically",
                event.getId(), event.getEventType(), event.getAggregateType(), event.getAggregateId(), maxRetries);
            outboxMetrics.recordEventDeadLettered(event.getEventType());
        }
    }
}
