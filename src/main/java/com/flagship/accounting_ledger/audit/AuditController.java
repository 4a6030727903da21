package com.flagship.accounting_ledger.audit;

import com.flagship.accounting_ledger.exception.ValidationException;
import com.flagship.accounting_ledger.exception.ValidationFailure;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/accounting/audit-log")
@RequiredArgsConstructor
public class AuditController {

    private static final int MAX_LIMIT = 500;

    private final AuditService auditService;

    @GetMapping
    public List<AuditLogResponse> recent(@RequestParam(value = "limit", defaultValue = "50") int limit) {
        if (limit <= 0) {
            throw new ValidationException(ValidationFailure.INVALID_REQUEST, "Limit must be positive");
        }
        return auditService.recent(Math.min(limit, MAX_LIMIT));
    }
}
