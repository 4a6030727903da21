package com.flagship.accounting_ledger.report.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.accounting_ledger.report.BalanceSheet;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class BalanceSheetResponse {

    @JsonProperty("as_of")
    Instant asOf;

    @JsonProperty("assets")
    long assets;

    @JsonProperty("liabilities")
    long liabilities;

    @JsonProperty("equity")
    long equity;

    @JsonProperty("retained_earnings")
    long retainedEarnings;

    @JsonProperty("liabilities_and_equity")
    long liabilitiesAndEquity;

    @JsonProperty("asset_accounts")
    List<AccountAmountResponse> assetAccounts;

    @JsonProperty("liability_accounts")
    List<AccountAmountResponse> liabilityAccounts;

    @JsonProperty("equity_accounts")
    List<AccountAmountResponse> equityAccounts;

    public static BalanceSheetResponse from(BalanceSheet sheet) {
        return BalanceSheetResponse.builder()
            .asOf(sheet.getAsOf())
            .assets(sheet.getAssets())
            .liabilities(sheet.getLiabilities())
            .equity(sheet.getEquity())
            .retainedEarnings(sheet.getRetainedEarnings())
            .liabilitiesAndEquity(sheet.getLiabilitiesAndEquity())
            .assetAccounts(AccountAmountResponse.fromAll(sheet.getAssetAccounts()))
            .liabilityAccounts(AccountAmountResponse.fromAll(sheet.getLiabilityAccounts()))
            .equityAccounts(AccountAmountResponse.fromAll(sheet.getEquityAccounts()))
            .build();
    }
}
