package com.flagship.debt_payoff.simulation;

import com.flagship.debt_payoff.debt.Debt;
import com.flagship.debt_payoff.override.PaymentOverride;
import com.flagship.debt_payoff.override.ScheduleOverride;
import com.flagship.debt_payoff.settings.PlannerSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Month-by-month debt payoff engine.
 *
 * Each month runs through the same phases:
 * 1. Order debts by the strategy, using current balances
 * 2. Accrue interest on every open debt (the post-interest balance is the month's ceiling)
 * 3. Pay minimums in order; minimums larger than the balance feed a surplus pool
 * 4. Spend the discretionary pool plus surplus on debts in order
 * 5. Apply payment overrides, capped at the ceiling
 * 6. Settle balances and close debts that reached zero
 *
 * A closed debt's minimum joins the discretionary pool from the following month.
 *
 * The engine is a pure function of its inputs. All running state lives in a
 * {@link Run} created per call, so concurrent calls never interfere.
 */
@Service
@Slf4j
public class PayoffSimulator {

    public static final int MAX_MONTHS = 600;

    private static final String CAPPED_WARNING = "Override for debt %d capped at remaining balance.";
    private static final String SHORTFALL_WARNING =
            "Overrides require more funds than available; need an additional %s.";
    private static final String UNALLOCATED_WARNING =
            "Overrides reduced payments; remaining budget left unallocated.";

    public SimulationResult simulate(PlannerSettings settings,
                                     List<Debt> debts,
                                     Collection<ScheduleOverride> scheduleOverrides) {
        return simulate(settings, debts, scheduleOverrides, null);
    }

    /**
     * Runs the simulation until every debt is paid off.
     *
     * @param settings balance date, monthly budget and strategy name
     * @param debts debts in entry order; this order is kept in every per-debt map
     * @param scheduleOverrides extra pool amounts by month
     * @param paymentOverrides fixed payments by month and debt, may be null
     * @return the ledger, per-debt summaries and totals
     * @throws SimulationException if the budget is too small, the strategy is unknown,
     *                             or debts remain after {@value #MAX_MONTHS} months
     */
    public SimulationResult simulate(PlannerSettings settings,
                                     List<Debt> debts,
                                     Collection<ScheduleOverride> scheduleOverrides,
                                     Collection<PaymentOverride> paymentOverrides) {
        List<DebtState> states = debts.stream().map(DebtState::from).toList();
        if (states.isEmpty()) {
            return SimulationResult.empty();
        }

        BigDecimal minPaymentsSum = Money.quantize(states.stream()
                .map(DebtState::getMinimumPayment)
                .reduce(Money.ZERO, BigDecimal::add));
        BigDecimal monthlyBudget = Money.quantize(settings.getMonthlyBudget());

        if (monthlyBudget.compareTo(minPaymentsSum) < 0) {
            log.debug("Rejecting simulation: budget={} below minimums={}", monthlyBudget, minPaymentsSum);
            throw SimulationException.insufficientBudget();
        }

        PayoffStrategy strategy = PayoffStrategy.fromName(settings.getStrategy());
        BigDecimal initialSnowball = Money.quantize(Money.max(monthlyBudget.subtract(minPaymentsSum), Money.ZERO));

        Run run = new Run(strategy, states, initialSnowball,
                scheduleAdditions(scheduleOverrides), fixedPaymentsByMonth(paymentOverrides));

        List<Long> summaryOrder = DebtOrdering.order(strategy, states).stream()
                .map(DebtState::getId)
                .toList();

        log.debug("Starting simulation: debts={}, strategy={}, budget={}, initialSnowball={}",
                states.size(), strategy.externalName(), monthlyBudget, initialSnowball);

        LocalDate balanceDate = settings.getBalanceDate();
        List<MonthRecord> months = new ArrayList<>();
        int monthIndex = 1;
        while (run.anyOpen()) {
            if (monthIndex > MAX_MONTHS) {
                throw SimulationException.exceededMaxDuration(MAX_MONTHS);
            }
            months.add(simulateMonth(run, monthIndex, CalendarMonths.monthDate(balanceDate, monthIndex)));
            monthIndex++;
        }

        int totalMonths = monthIndex - 1;
        List<DebtSummary> summaries = summarize(run, summaryOrder, balanceDate, totalMonths);
        SimulationTotals totals = new SimulationTotals(
                Money.quantize(run.totalInterest), totalMonths, minPaymentsSum, initialSnowball);

        log.debug("Simulation finished: months={}, totalInterest={}", totalMonths, totals.getTotalInterest());
        return new SimulationResult(Collections.unmodifiableList(months), summaries, totals);
    }

    private MonthRecord simulateMonth(Run run, int monthIndex, LocalDate monthDate) {
        List<DebtState> ordered = DebtOrdering.order(run.strategy, run.states);

        BigDecimal interestAccrued = Money.ZERO;
        for (DebtState debt : ordered) {
            if (!debt.isOpen()) {
                continue;
            }
            interestAccrued = Money.quantize(interestAccrued.add(debt.accrueInterest()));
        }
        run.totalInterest = Money.quantize(run.totalInterest.add(interestAccrued));

        Map<Long, BigDecimal> ceilings = new LinkedHashMap<>();
        Map<Long, BigDecimal> payments = new LinkedHashMap<>();
        for (DebtState debt : run.states) {
            ceilings.put(debt.getId(), debt.getBalance());
            payments.put(debt.getId(), Money.ZERO);
        }

        BigDecimal additionalAmount = Money.quantize(run.scheduleAdditions.getOrDefault(monthIndex, Money.ZERO));
        BigDecimal availablePool = Money.quantize(run.initialSnowball.add(run.freedMinimums).add(additionalAmount));

        // Minimums first
        BigDecimal surplus = Money.ZERO;
        for (DebtState debt : ordered) {
            if (!debt.isOpen()) {
                continue;
            }
            BigDecimal payment = Money.min(debt.getMinimumPayment(), debt.getBalance());
            debt.pay(payment);
            payments.merge(debt.getId(), payment, Money::sum);
            if (debt.getMinimumPayment().compareTo(payment) > 0) {
                surplus = Money.quantize(surplus.add(debt.getMinimumPayment().subtract(payment)));
            }
        }

        // Discretionary pool goes to the first open debts in order
        BigDecimal remaining = Money.quantize(availablePool.add(surplus));
        for (DebtState debt : ordered) {
            if (!Money.isPositive(remaining)) {
                break;
            }
            if (!debt.isOpen()) {
                continue;
            }
            BigDecimal payment = Money.min(remaining, debt.getBalance());
            debt.pay(payment);
            payments.merge(debt.getId(), payment, Money::sum);
            remaining = Money.quantize(remaining.subtract(payment));
        }

        Map<Long, BigDecimal> defaultPayments = Collections.unmodifiableMap(new LinkedHashMap<>(payments));
        Map<Long, BigDecimal> finalPayments = new LinkedHashMap<>(payments);
        List<String> warnings = applyPaymentOverrides(
                run.fixedPayments.getOrDefault(monthIndex, Map.of()), ceilings, finalPayments);

        BigDecimal totalDefault = Money.total(defaultPayments.values());
        BigDecimal totalFinal = Money.total(finalPayments.values());
        int comparison = totalFinal.compareTo(totalDefault);
        if (comparison > 0) {
            warnings.add(String.format(SHORTFALL_WARNING,
                    Money.display(totalFinal.subtract(totalDefault))));
        } else if (comparison < 0) {
            warnings.add(UNALLOCATED_WARNING);
        }

        // Settle against the ceiling so overrides are measured from the post-interest balance
        BigDecimal newlyFreed = Money.ZERO;
        Map<Long, BigDecimal> remainingBalances = new LinkedHashMap<>();
        for (DebtState debt : run.states) {
            debt.settle(ceilings.get(debt.getId()), finalPayments.get(debt.getId()));
            if (!debt.isOpen() && !debt.isClosed()) {
                debt.close(monthIndex);
                newlyFreed = Money.quantize(newlyFreed.add(debt.getMinimumPayment()));
            }
            remainingBalances.put(debt.getId(), debt.getBalance());
        }
        run.freedMinimums = Money.quantize(run.freedMinimums.add(newlyFreed));

        if (!warnings.isEmpty()) {
            log.debug("Month {} raised {} override warning(s)", monthIndex, warnings.size());
        }

        return MonthRecord.builder()
                .monthIndex(monthIndex)
                .date(monthDate)
                .monthLabel(CalendarMonths.label(monthDate))
                .interestAccrued(interestAccrued)
                .snowballAmount(availablePool)
                .additionalAmount(additionalAmount)
                .defaultPayments(defaultPayments)
                .payments(Collections.unmodifiableMap(finalPayments))
                .remainingBalances(Collections.unmodifiableMap(remainingBalances))
                .warnings(List.copyOf(warnings))
                .build();
    }

    /**
     * Replaces computed payments with the month's fixed amounts.
     * Overrides never trigger reallocation of the difference to other debts.
     */
    private List<String> applyPaymentOverrides(Map<Long, BigDecimal> overrides,
                                               Map<Long, BigDecimal> ceilings,
                                               Map<Long, BigDecimal> finalPayments) {
        List<String> warnings = new ArrayList<>();
        for (Map.Entry<Long, BigDecimal> override : overrides.entrySet()) {
            Long debtId = override.getKey();
            if (!finalPayments.containsKey(debtId)) {
                continue;
            }
            BigDecimal ceiling = ceilings.getOrDefault(debtId, Money.ZERO);
            BigDecimal amount = override.getValue();
            if (amount.compareTo(ceiling) > 0) {
                warnings.add(String.format(CAPPED_WARNING, debtId));
            }
            finalPayments.put(debtId, Money.quantize(Money.min(ceiling, amount)));
        }
        return warnings;
    }

    private List<DebtSummary> summarize(Run run, List<Long> summaryOrder, LocalDate balanceDate, int totalMonths) {
        Map<Long, DebtState> byId = new LinkedHashMap<>();
        run.states.forEach(debt -> byId.put(debt.getId(), debt));

        List<DebtSummary> summaries = new ArrayList<>();
        for (Long debtId : summaryOrder) {
            DebtState debt = byId.get(debtId);
            Integer payoffMonth = debt.getPayoffMonthIndex();
            LocalDate payoffDate = payoffMonth != null
                    ? CalendarMonths.monthDate(balanceDate, payoffMonth)
                    : null;
            summaries.add(DebtSummary.builder()
                    .id(debt.getId())
                    .creditor(debt.getCreditor())
                    .initialBalance(debt.getInitialBalance())
                    .interestPaid(debt.getInterestPaid())
                    .monthsToPayoff(payoffMonth != null ? payoffMonth : totalMonths)
                    .payoffDate(payoffDate)
                    .payoffMonthLabel(payoffDate != null ? CalendarMonths.label(payoffDate) : null)
                    .build());
        }
        return Collections.unmodifiableList(summaries);
    }

    private static Map<Integer, BigDecimal> scheduleAdditions(Collection<ScheduleOverride> overrides) {
        Map<Integer, BigDecimal> additions = new LinkedHashMap<>();
        if (overrides != null) {
            for (ScheduleOverride override : overrides) {
                additions.put(override.getMonthIndex(), Money.quantize(override.getAdditionalAmount()));
            }
        }
        return additions;
    }

    private static Map<Integer, Map<Long, BigDecimal>> fixedPaymentsByMonth(Collection<PaymentOverride> overrides) {
        Map<Integer, Map<Long, BigDecimal>> byMonth = new LinkedHashMap<>();
        if (overrides == null) {
            return byMonth;
        }
        for (PaymentOverride override : overrides) {
            BigDecimal amount = Money.quantize(override.getAmount());
            if (amount.signum() < 0) {
                continue;
            }
            byMonth.computeIfAbsent(override.getMonthIndex(), month -> new LinkedHashMap<>())
                    .put(override.getDebtId(), amount);
        }
        return byMonth;
    }

    /**
     * Mutable context of a single simulation call.
     */
    private static final class Run {
        private final PayoffStrategy strategy;
        private final List<DebtState> states;
        private final BigDecimal initialSnowball;
        private final Map<Integer, BigDecimal> scheduleAdditions;
        private final Map<Integer, Map<Long, BigDecimal>> fixedPayments;

        private BigDecimal freedMinimums = Money.ZERO;
        private BigDecimal totalInterest = Money.ZERO;

        private Run(PayoffStrategy strategy,
                    List<DebtState> states,
                    BigDecimal initialSnowball,
                    Map<Integer, BigDecimal> scheduleAdditions,
                    Map<Integer, Map<Long, BigDecimal>> fixedPayments) {
            this.strategy = strategy;
            this.states = states;
            this.initialSnowball = initialSnowball;
            this.scheduleAdditions = scheduleAdditions;
            this.fixedPayments = fixedPayments;
        }

        private boolean anyOpen() {
            return states.stream().anyMatch(DebtState::isOpen);
        }
    }
}
