package com.flagship.accounting_ledger.report;

import com.flagship.accounting_ledger.ledger.LedgerQueryService;
import com.flagship.accounting_ledger.ledger.dto.AccountLedgerResponse;
import com.flagship.accounting_ledger.report.dto.BalanceSheetResponse;
import com.flagship.accounting_ledger.report.dto.IntegrityReportResponse;
import com.flagship.accounting_ledger.report.dto.ProfitLossResponse;
import com.flagship.accounting_ledger.report.dto.TrialBalanceResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/accounting/reports")
@RequiredArgsConstructor
@Slf4j
public class ReportController {

    private final ReportService reportService;
    private final LedgerQueryService ledgerQueryService;

    @GetMapping("/trial-balance")
    public TrialBalanceResponse trialBalance() {
        return TrialBalanceResponse.from(reportService.generateTrialBalance());
    }

    @GetMapping("/profit-loss")
    public ProfitLossResponse profitLoss(
            @RequestParam(value = "startDate", required = false) String startDate,
            @RequestParam(value = "endDate", required = false) String endDate) {
        return ProfitLossResponse.from(reportService.generateProfitLoss(
            DateParameters.parse("startDate", startDate),
            DateParameters.parse("endDate", endDate)
        ));
    }

    @GetMapping("/balance-sheet")
    public BalanceSheetResponse balanceSheet(@RequestParam(value = "asOf", required = false) String asOf) {
        return BalanceSheetResponse.from(reportService.generateBalanceSheet(DateParameters.parse("asOf", asOf)));
    }

    @GetMapping("/ledger/{accountCode}")
    public AccountLedgerResponse accountLedger(@PathVariable("accountCode") String accountCode) {
        return AccountLedgerResponse.from(ledgerQueryService.getAccountLedger(accountCode));
    }

    @PostMapping("/integrity-check")
    public IntegrityReportResponse integrityCheck() {
        log.info("Manual ledger integrity check requested");
        return IntegrityReportResponse.from(reportService.verifyIntegrity());
    }
}
