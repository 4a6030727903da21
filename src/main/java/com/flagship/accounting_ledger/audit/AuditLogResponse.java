package com.flagship.accounting_ledger.audit;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.time.Instant;

@Value
public class AuditLogResponse {

    @JsonProperty("id")
    Long id;

    @JsonProperty("action")
    AuditAction action;

    @JsonProperty("entity_type")
    String entityType;

    @JsonProperty("entity_id")
    String entityId;

    @JsonProperty("details")
    String details;

    @JsonProperty("correlation_id")
    String correlationId;

    @JsonProperty("created_at")
    Instant createdAt;

    public static AuditLogResponse from(AuditLogEntity entity) {
        return new AuditLogResponse(
            entity.getId(),
            entity.getAction(),
            entity.getEntityType(),
            entity.getEntityId(),
            entity.getDetails(),
            entity.getCorrelationId(),
            entity.getCreatedAt()
        );
    }
}
