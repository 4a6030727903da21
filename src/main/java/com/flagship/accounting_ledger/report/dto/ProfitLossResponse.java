package com.flagship.accounting_ledger.report.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.accounting_ledger.report.ProfitLoss;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class ProfitLossResponse {

    @JsonProperty("start_date")
    Instant startDate;

    @JsonProperty("end_date")
    Instant endDate;

    @JsonProperty("revenue_total")
    long revenueTotal;

    @JsonProperty("expense_total")
    long expenseTotal;

    @JsonProperty("net_income")
    long netIncome;

    @JsonProperty("revenues")
    List<AccountAmountResponse> revenues;

    @JsonProperty("expenses")
    List<AccountAmountResponse> expenses;

    public static ProfitLossResponse from(ProfitLoss profitLoss) {
        return ProfitLossResponse.builder()
            .startDate(profitLoss.getStart())
            .endDate(profitLoss.getEnd())
            .revenueTotal(profitLoss.getRevenueTotal())
            .expenseTotal(profitLoss.getExpenseTotal())
            .netIncome(profitLoss.getNetIncome())
            .revenues(AccountAmountResponse.fromAll(profitLoss.getRevenues()))
            .expenses(AccountAmountResponse.fromAll(profitLoss.getExpenses()))
            .build();
    }
}
