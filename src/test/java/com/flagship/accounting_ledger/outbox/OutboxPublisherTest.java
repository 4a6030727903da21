package com.flagship.accounting_ledger.outbox;

import com.flagship.accounting_ledger.observability.OutboxMetrics;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.header.Header;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Outbox draining against a mocked Kafka producer: acknowledged sends are marked published,
 * failed sends are retried until the limit and then counted as dead-lettered.
 */
class OutboxPublisherTest {

    private static final String TOPIC = "accounting.ledger";

    private OutboxService outboxService;
    private KafkaTemplate<String, String> kafkaTemplate;
    private OutboxMetrics outboxMetrics;
    private OutboxPublisher publisher;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        outboxService = mock(OutboxService.class);
        kafkaTemplate = mock(KafkaTemplate.class);
        outboxMetrics = mock(OutboxMetrics.class);

        publisher = new OutboxPublisher(outboxService, kafkaTemplate, outboxMetrics);
        ReflectionTestUtils.setField(publisher, "ledgerTopic", TOPIC);
        ReflectionTestUtils.setField(publisher, "batchSize", 100);
        ReflectionTestUtils.setField(publisher, "maxRetries", 3);
        ReflectionTestUtils.setField(publisher, "sendTimeoutMs", 1000L);
    }

    private static OutboxEvent event(String aggregateId, int retryCount, String correlationId) {
        return new OutboxEvent(UUID.randomUUID(), "JournalEntry", aggregateId, "JournalEntryPosted",
            "{\"entry_id\":" + aggregateId + "}", correlationId, Instant.parse("2024-01-01T00:00:00Z"),
            null, retryCount, null, 1L);
    }

    private static CompletableFuture<SendResult<String, String>> acknowledged() {
        return CompletableFuture.completedFuture(new SendResult<>(
            new ProducerRecord<>(TOPIC, "key", "value"),
            new RecordMetadata(new TopicPartition(TOPIC, 0), 42L, 0, 0L, 0, 0)));
    }

    private static CompletableFuture<SendResult<String, String>> rejected() {
        return CompletableFuture.failedFuture(new IllegalStateException("broker unavailable"));
    }

    private static String header(ProducerRecord<String, String> record, String name) {
        Header header = record.headers().lastHeader(name);
        return header == null ? null : new String(header.value(), StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Records are keyed by aggregate id and carry event and correlation headers")
    @SuppressWarnings("unchecked")
    void testRecordShape() {
        OutboxEvent pending = event("7", 0, "req-123");
        when(kafkaTemplate.send(any(ProducerRecord.class))).thenReturn(acknowledged());

        publisher.publishEvent(pending);

        ArgumentCaptor<ProducerRecord<String, String>> captor = ArgumentCaptor.forClass(ProducerRecord.class);
        verify(kafkaTemplate).send(captor.capture());
        ProducerRecord<String, String> record = captor.getValue();
        assertEquals(TOPIC, record.topic());
        assertEquals("7", record.key());
        assertEquals(pending.getPayload(), record.value());
        assertEquals(pending.getId().toString(), header(record, "event-id"));
        assertEquals("JournalEntryPosted", header(record, "event-type"));
        assertEquals("JournalEntry", header(record, "aggregate-type"));
        assertEquals("req-123", header(record, "X-Correlation-ID"));

        verify(outboxService).markPublished(pending.getId());
        verify(outboxMetrics).recordEventPublished("JournalEntryPosted");
    }

    @Test
    @DisplayName("Events raised outside a request have no correlation header")
    @SuppressWarnings("unchecked")
    void testNoCorrelationHeader() {
        when(kafkaTemplate.send(any(ProducerRecord.class))).thenReturn(acknowledged());

        publisher.publishEvent(event("8", 0, null));

        ArgumentCaptor<ProducerRecord<String, String>> captor = ArgumentCaptor.forClass(ProducerRecord.class);
        verify(kafkaTemplate).send(captor.capture());
        assertNull(header(captor.getValue(), "X-Correlation-ID"));
    }

    @Test
    @DisplayName("A batch is published and acknowledged one event at a time")
    @SuppressWarnings("unchecked")
    void testPublishesInOrder() {
        OutboxEvent first = event("1", 0, null);
        OutboxEvent second = event("2", 0, null);
        when(outboxService.findUnpublishedEvents(100, 3)).thenReturn(List.of(first, second));
        when(kafkaTemplate.send(any(ProducerRecord.class))).thenReturn(acknowledged());

        publisher.publishPendingEvents();

        var order = inOrder(kafkaTemplate, outboxService);
        order.verify(kafkaTemplate).send(any(ProducerRecord.class));
        order.verify(outboxService).markPublished(first.getId());
        order.verify(kafkaTemplate).send(any(ProducerRecord.class));
        order.verify(outboxService).markPublished(second.getId());
        verify(outboxMetrics, times(2)).recordEventPublished("JournalEntryPosted");
    }

    @Test
    @DisplayName("A failed send is recorded and the event stays unpublished")
    @SuppressWarnings("unchecked")
    void testFailedSend() {
        OutboxEvent pending = event("5", 0, null);
        when(kafkaTemplate.send(any(ProducerRecord.class))).thenReturn(rejected());

        publisher.publishEvent(pending);

        verify(outboxService, never()).markPublished(pending.getId());
        verify(outboxService).markFailed(pending.getId(), "broker unavailable");
        verify(outboxMetrics).recordEventPublishFailed("JournalEntryPosted");
        verify(outboxMetrics, never()).recordEventDeadLettered(anyString());
    }

    @Test
    @DisplayName("Failing the last allowed attempt dead-letters the event")
    @SuppressWarnings("unchecked")
    void testDeadLetter() {
        OutboxEvent exhausted = event("6", 2, null);
        when(kafkaTemplate.send(any(ProducerRecord.class))).thenReturn(rejected());

        publisher.publishEvent(exhausted);

        verify(outboxService).markFailed(eq(exhausted.getId()), anyString());
        verify(outboxMetrics).recordEventDeadLettered("JournalEntryPosted");
    }

    @Test
    @DisplayName("A failing poll does not escape the scheduler thread")
    @SuppressWarnings("unchecked")
    void testPollingFailure() {
        when(outboxService.findUnpublishedEvents(anyInt(), anyInt()))
            .thenThrow(new IllegalStateException("database down"));

        publisher.publishPendingEvents();

        verify(kafkaTemplate, never()).send(any(ProducerRecord.class));
    }
}
