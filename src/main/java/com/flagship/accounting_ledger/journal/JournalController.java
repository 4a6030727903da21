package com.flagship.accounting_ledger.journal;

import com.flagship.accounting_ledger.exception.ValidationException;
import com.flagship.accounting_ledger.exception.ValidationFailure;
import com.flagship.accounting_ledger.journal.dto.CreateJournalEntryRequest;
import com.flagship.accounting_ledger.journal.dto.JournalEntryResponse;
import com.flagship.accounting_ledger.journal.dto.ReverseJournalEntryRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST endpoints of the journal.
 *
 * Posting is idempotent when a client reference is supplied, either as {@code client_ref}
 * in the body or as the {@code Idempotency-Key} header. The first call answers 201, a
 * replay answers 200 with the same entry.
 */
@RestController
@RequestMapping("/api/accounting/journal")
@RequiredArgsConstructor
@Slf4j
public class JournalController {

    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final JournalService journalService;

    @GetMapping
    public List<JournalEntryResponse> listEntries(@RequestParam(value = "limit", required = false) Integer limit) {
        return journalService.listJournalEntries(limit).stream()
            .map(JournalEntryResponse::from)
            .toList();
    }

    @PostMapping
    public ResponseEntity<JournalEntryResponse> createEntry(
            @Valid @RequestBody CreateJournalEntryRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        String clientRef = resolveClientRef(request.getClientRef(), idempotencyKey);
        log.info("Received journal entry request: clientRef={}, lines={}",
            clientRef, request.getLines() == null ? 0 : request.getLines().size());

        PostingResult result = journalService.post(request.toDomain(clientRef));
        return respond(result);
    }

    @GetMapping("/{id}")
    public JournalEntryResponse getEntry(@PathVariable("id") long id) {
        return JournalEntryResponse.from(journalService.getJournalEntry(id));
    }

    @PostMapping("/{id}/reverse")
    public ResponseEntity<JournalEntryResponse> reverseEntry(
            @PathVariable("id") long id,
            @Valid @RequestBody(required = false) ReverseJournalEntryRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        String clientRef = resolveClientRef(request == null ? null : request.getClientRef(), idempotencyKey);
        log.info("Received reversal request: entryId={}, clientRef={}", id, clientRef);

        return respond(journalService.reverseJournalEntry(id, clientRef));
    }

    private static ResponseEntity<JournalEntryResponse> respond(PostingResult result) {
        JournalEntryResponse body = JournalEntryResponse.from(result.getEntry());
        return result.isCreated()
            ? ResponseEntity.status(HttpStatus.CREATED).body(body)
            : ResponseEntity.ok(body);
    }

    private static String resolveClientRef(String fromBody, String fromHeader) {
        boolean hasBody = fromBody != null && !fromBody.isBlank();
        boolean hasHeader = fromHeader != null && !fromHeader.isBlank();
        if (hasBody && hasHeader && !fromBody.trim().equals(fromHeader.trim())) {
            throw new ValidationException(ValidationFailure.INVALID_REQUEST,
                "client_ref and " + IDEMPOTENCY_KEY_HEADER + " header disagree");
        }
        return hasBody ? fromBody : fromHeader;
    }
}
