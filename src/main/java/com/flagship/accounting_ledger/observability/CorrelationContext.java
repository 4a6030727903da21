package com.flagship.accounting_ledger.observability;

import java.util.Optional;
import java.util.UUID;

/**
 * Correlation ID of the request being served on this thread, and the MDC keys the
 * accounting services log under.
 *
 * The ID is stamped on audit rows and outbox events written while the request runs, and
 * travels to Kafka as a record header, so one posting can be traced from HTTP to consumers.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String ENTRY_ID_MDC_KEY = "entryId";
    public static final String ACCOUNT_CODE_MDC_KEY = "accountCode";

    static final int MAX_LENGTH = 64;

    private static final ThreadLocal<String> CURRENT = new ThreadLocal<>();

    private CorrelationContext() {
    }

    /**
     * Empty outside a request, e.g. on scheduler threads.
     */
    public static Optional<String> current() {
        return Optional.ofNullable(CURRENT.get());
    }

    /**
     * Uses the caller's ID when it is usable, otherwise a fresh one. Returns the ID in effect.
     */
    static String begin(String requested) {
        String id = requested == null || requested.isBlank() || requested.length() > MAX_LENGTH
            ? newId()
            : requested.trim();
        CURRENT.set(id);
        return id;
    }

    static void end() {
        CURRENT.remove();
    }

    static String newId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
