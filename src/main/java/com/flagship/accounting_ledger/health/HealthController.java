package com.flagship.accounting_ledger.health;

import com.flagship.accounting_ledger.integrity.LedgerIntegrityMonitor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness/readiness endpoint outside Actuator. Reports DOWN when the database is unreachable
 * or the ledger has been halted by an integrity violation.
 */
@RestController
@Slf4j
public class HealthController {

    private final DataSource dataSource;
    private final LedgerIntegrityMonitor integrityMonitor;
    private final Clock clock;

    public HealthController(DataSource dataSource, LedgerIntegrityMonitor integrityMonitor, Clock clock) {
        this.dataSource = dataSource;
        this.integrityMonitor = integrityMonitor;
        this.clock = clock;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now(clock).toString());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");

        boolean halted = integrityMonitor.isHalted();
        response.put("ledgerIntegrity", halted ? "DOWN" : "UP");
        integrityMonitor.getViolation()
            .ifPresent(violation -> response.put("integrityViolation", violation.getIdentity()));

        if (!dbHealthy || halted) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }
}
