package com.flagship.accounting_ledger.report.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.accounting_ledger.report.IntegrityReport;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class IntegrityReportResponse {

    @JsonProperty("status")
    String status;

    @JsonProperty("checked_at")
    Instant checkedAt;

    @JsonProperty("total_debits")
    long totalDebits;

    @JsonProperty("total_credits")
    long totalCredits;

    @JsonProperty("assets")
    long assets;

    @JsonProperty("liabilities_and_equity")
    long liabilitiesAndEquity;

    @JsonProperty("accounts_reconciled")
    int accountsReconciled;

    @JsonProperty("halted")
    boolean halted;

    public static IntegrityReportResponse from(IntegrityReport report) {
        return IntegrityReportResponse.builder()
            .status(report.isHalted() ? "HALTED" : "OK")
            .checkedAt(report.getCheckedAt())
            .totalDebits(report.getTotalDebits())
            .totalCredits(report.getTotalCredits())
            .assets(report.getAssets())
            .liabilitiesAndEquity(report.getLiabilitiesAndEquity())
            .accountsReconciled(report.getAccountsReconciled())
            .halted(report.isHalted())
            .build();
    }
}
