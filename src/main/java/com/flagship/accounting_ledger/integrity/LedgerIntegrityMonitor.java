package com.flagship.accounting_ledger.integrity;

import com.flagship.accounting_ledger.exception.LedgerIntegrityException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Latches the first ledger integrity violation seen by this process.
 *
 * Once latched the ledger is considered halted: automated corrections are refused and health
 * reports DOWN. Only a restart clears the latch.
 */
@Component
@Slf4j
public class LedgerIntegrityMonitor {

    private final AtomicReference<Violation> violation = new AtomicReference<>();
    private final Counter violations;
    private final Clock clock;

    public LedgerIntegrityMonitor(MeterRegistry registry, Clock clock) {
        this.clock = clock;
        this.violations = Counter.builder("ledger.integrity.violations")
            .description("Number of failed ledger identity checks")
            .register(registry);
    }

    /**
     * Records a failed identity and returns the exception the caller should throw.
     */
    public LedgerIntegrityException recordViolation(String identity, String detail) {
        Violation current = new Violation(identity, detail, Instant.now(clock));
        violations.increment();
        if (violation.compareAndSet(null, current)) {
            log.error("LEDGER INTEGRITY VIOLATION: {} failed: {}. Automated corrections are halted.",
                identity, detail);
        } else {
            log.error("LEDGER INTEGRITY VIOLATION (ledger already halted): {} failed: {}", identity, detail);
        }
        return new LedgerIntegrityException(identity + " failed: " + detail);
    }

    public boolean isHalted() {
        return violation.get() != null;
    }

    public Optional<Violation> getViolation() {
        return Optional.ofNullable(violation.get());
    }

    /**
     * @throws LedgerIntegrityException if a violation has been latched
     */
    public void assertCorrectionsAllowed() {
        Violation current = violation.get();
        if (current != null) {
            throw new LedgerIntegrityException(
                "Ledger is halted after an integrity violation (" + current.getIdentity()
                    + " at " + current.getDetectedAt() + "); automated corrections are refused");
        }
    }

    @Value
    public static class Violation {
        String identity;
        String detail;
        Instant detectedAt;
    }
}
