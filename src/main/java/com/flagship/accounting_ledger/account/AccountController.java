package com.flagship.accounting_ledger.account;

import com.flagship.accounting_ledger.account.dto.AccountBalanceResponse;
import com.flagship.accounting_ledger.account.dto.AccountResponse;
import com.flagship.accounting_ledger.account.dto.CreateAccountRequest;
import com.flagship.accounting_ledger.ledger.LedgerQueryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/accounting/accounts")
@RequiredArgsConstructor
@Slf4j
public class AccountController {

    private final AccountService accountService;
    private final LedgerQueryService ledgerQueryService;

    @GetMapping
    public List<AccountResponse> listAccounts(@RequestParam(value = "type", required = false) String type) {
        AccountType filter = type == null || type.isBlank() ? null : AccountType.fromString(type);
        return accountService.listAccounts(filter).stream()
            .map(AccountResponse::from)
            .toList();
    }

    @PostMapping
    public ResponseEntity<AccountResponse> createAccount(@Valid @RequestBody CreateAccountRequest request) {
        log.info("Received account creation request: code={}, type={}", request.getCode(), request.getType());

        Account account = accountService.createAccount(
            request.getCode(),
            request.getName(),
            AccountType.fromString(request.getType()),
            request.getDescription()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(AccountResponse.from(account));
    }

    @GetMapping("/{code}")
    public AccountResponse getAccount(@PathVariable("code") String code) {
        return AccountResponse.from(accountService.getAccount(code));
    }

    @PostMapping("/{code}/deactivate")
    public AccountResponse deactivateAccount(@PathVariable("code") String code) {
        return AccountResponse.from(accountService.deactivateAccount(code));
    }

    @GetMapping("/{code}/balance")
    public AccountBalanceResponse getBalance(@PathVariable("code") String code) {
        Account account = accountService.getAccount(code);
        return new AccountBalanceResponse(
            account.getCode(),
            account.getNormalBalanceSide(),
            ledgerQueryService.getAccountBalance(code)
        );
    }
}
