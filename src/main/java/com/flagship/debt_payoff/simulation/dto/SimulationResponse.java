package com.flagship.debt_payoff.simulation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.debt_payoff.simulation.DebtSummary;
import com.flagship.debt_payoff.simulation.Money;
import com.flagship.debt_payoff.simulation.MonthRecord;
import com.flagship.debt_payoff.simulation.SimulationResult;
import com.flagship.debt_payoff.simulation.SimulationTotals;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Response DTO for a payoff simulation.
 *
 * Every money field is a fixed 2-decimal string, never a JSON number.
 * Per-debt maps are keyed by the debt id as a string.
 */
@Value
public class SimulationResponse {

    @JsonProperty("months")
    List<MonthResponse> months;

    @JsonProperty("debts")
    List<DebtSummaryResponse> debts;

    @JsonProperty("totals")
    TotalsResponse totals;

    public static SimulationResponse from(SimulationResult result) {
        return new SimulationResponse(
            result.getMonths().stream().map(MonthResponse::from).toList(),
            result.getDebts().stream().map(DebtSummaryResponse::from).toList(),
            TotalsResponse.from(result.getTotals())
        );
    }

    private static Map<String, String> formatAmounts(Map<Long, BigDecimal> amounts) {
        Map<String, String> formatted = new LinkedHashMap<>();
        amounts.forEach((debtId, amount) -> formatted.put(String.valueOf(debtId), Money.format(amount)));
        return formatted;
    }

    @Value
    @Builder
    public static class MonthResponse {

        @JsonProperty("monthIndex")
        int monthIndex;

        @JsonProperty("monthLabel")
        String monthLabel;

        @JsonProperty("dateISO")
        String dateIso;

        @JsonProperty("interestAccrued")
        String interestAccrued;

        @JsonProperty("snowballAmount")
        String snowballAmount;

        @JsonProperty("additionalAmount")
        String additionalAmount;

        @JsonProperty("defaultPayments")
        Map<String, String> defaultPayments;

        @JsonProperty("payments")
        Map<String, String> payments;

        @JsonProperty("remainingBalances")
        Map<String, String> remainingBalances;

        @JsonProperty("paymentOverrideWarnings")
        @JsonInclude(JsonInclude.Include.NON_EMPTY)
        List<String> paymentOverrideWarnings;

        static MonthResponse from(MonthRecord month) {
            return MonthResponse.builder()
                .monthIndex(month.getMonthIndex())
                .monthLabel(month.getMonthLabel())
                .dateIso(month.getDate().toString())
                .interestAccrued(Money.format(month.getInterestAccrued()))
                .snowballAmount(Money.format(month.getSnowballAmount()))
                .additionalAmount(Money.format(month.getAdditionalAmount()))
                .defaultPayments(formatAmounts(month.getDefaultPayments()))
                .payments(formatAmounts(month.getPayments()))
                .remainingBalances(formatAmounts(month.getRemainingBalances()))
                .paymentOverrideWarnings(month.hasWarnings() ? month.getWarnings() : null)
                .build();
        }
    }

    @Value
    @Builder
    public static class DebtSummaryResponse {

        @JsonProperty("id")
        long id;

        @JsonProperty("creditor")
        String creditor;

        @JsonProperty("initialBalance")
        String initialBalance;

        @JsonProperty("interestPaid")
        String interestPaid;

        @JsonProperty("monthsToPayoff")
        int monthsToPayoff;

        @JsonProperty("payoffMonthLabel")
        String payoffMonthLabel;

        @JsonProperty("payoffDateISO")
        String payoffDateIso;

        static DebtSummaryResponse from(DebtSummary summary) {
            return DebtSummaryResponse.builder()
                .id(summary.getId())
                .creditor(summary.getCreditor())
                .initialBalance(Money.format(summary.getInitialBalance()))
                .interestPaid(Money.format(summary.getInterestPaid()))
                .monthsToPayoff(summary.getMonthsToPayoff())
                .payoffMonthLabel(summary.getPayoffMonthLabel())
                .payoffDateIso(summary.getPayoffDate() != null ? summary.getPayoffDate().toString() : null)
                .build();
        }
    }

    @Value
    public static class TotalsResponse {

        @JsonProperty("totalInterest")
        String totalInterest;

        @JsonProperty("totalMonths")
        int totalMonths;

        @JsonProperty("minPaymentsSum")
        String minPaymentsSum;

        @JsonProperty("minimumMonthlyPayment")
        String minimumMonthlyPayment;

        @JsonProperty("initialSnowball")
        String initialSnowball;

        static TotalsResponse from(SimulationTotals totals) {
            return new TotalsResponse(
                Money.format(totals.getTotalInterest()),
                totals.getTotalMonths(),
                Money.format(totals.getMinPaymentsSum()),
                Money.format(totals.getMinimumMonthlyPayment()),
                Money.format(totals.getInitialSnowball())
            );
        }
    }
}
