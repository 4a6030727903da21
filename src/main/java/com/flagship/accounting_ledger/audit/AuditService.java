package com.flagship.accounting_ledger.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.accounting_ledger.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Writes the accounting audit trail.
 *
 * Audit rows are written inside the caller's transaction, so an account or journal entry
 * and its audit record commit or roll back together. Each row keeps the correlation ID of
 * the request that caused it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditService {

    private final AuditLogRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Transactional(propagation = Propagation.MANDATORY)
    public void record(AuditAction action, String entityType, String entityId, Map<String, ?> details) {
        AuditLogEntity entity = AuditLogEntity.create(action, entityType, entityId, serializeDetails(details),
            CorrelationContext.current().orElse(null), Instant.now(clock));
        repository.save(entity);
        log.debug("Audit: action={}, entityType={}, entityId={}", action, entityType, entityId);
    }

    @Transactional(readOnly = true)
    public List<AuditLogResponse> recent(int limit) {
        return repository.findAllByOrderByIdDesc(PageRequest.of(0, limit))
            .stream()
            .map(AuditLogResponse::from)
            .toList();
    }

    private String serializeDetails(Map<String, ?> details) {
        if (details == null || details.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize audit details", e);
        }
    }
}
