package com.flagship.accounting_ledger.integrity;

import com.flagship.accounting_ledger.exception.LedgerIntegrityException;
import com.flagship.accounting_ledger.report.IntegrityReport;
import com.flagship.accounting_ledger.report.ReportService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically verifies the ledger identities. A failure is latched by
 * {@link LedgerIntegrityMonitor} inside the report service.
 */
@Component
@ConditionalOnProperty(name = "ledger.integrity.check.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class IntegrityCheckScheduler {

    private final ReportService reportService;

    @Scheduled(
        fixedDelayString = "${ledger.integrity.check.interval-ms:300000}",
        initialDelayString = "${ledger.integrity.check.initial-delay-ms:60000}"
    )
    public void runCheck() {
        try {
            IntegrityReport report = reportService.verifyIntegrity();
            log.debug("Scheduled integrity check passed: accounts={}", report.getAccountsReconciled());
        } catch (LedgerIntegrityException e) {
            // Already logged and latched by the monitor.
            log.error("Scheduled integrity check failed: {}", e.getMessage());
        } catch (Exception e) {
            log.error("Scheduled integrity check could not run", e);
        }
    }
}
