package com.flagship.debt_payoff.simulation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Total orders over debts, one per {@link PayoffStrategy}.
 *
 * Every order ends in a creditor-name tie-break (case-insensitive) so the
 * schedule is reproducible for identical inputs.
 */
final class DebtOrdering {

    /** Sort key for debts without a custom priority. */
    static final int NO_PRIORITY = Integer.MAX_VALUE;

    private static final Comparator<DebtState> BY_CREDITOR =
            Comparator.comparing(debt -> debt.getCreditor().toLowerCase(Locale.ROOT));

    private static final Comparator<DebtState> AVALANCHE =
            Comparator.comparing(DebtState::getApr, Comparator.reverseOrder())
                    .thenComparing(DebtState::getBalance)
                    .thenComparing(BY_CREDITOR);

    private static final Comparator<DebtState> SNOWBALL =
            Comparator.comparing(DebtState::getBalance)
                    .thenComparing(DebtState::getApr, Comparator.reverseOrder())
                    .thenComparing(BY_CREDITOR);

    private static final Comparator<DebtState> ENTERED =
            Comparator.comparingInt(DebtState::getPosition);

    private static final Comparator<DebtState> CUSTOM =
            Comparator.comparingInt(DebtOrdering::prioritySortKey)
                    .thenComparing(DebtState::getBalance)
                    .thenComparing(BY_CREDITOR);

    private DebtOrdering() {
        // Utility class
    }

    /**
     * Returns a new list with the debts in payoff order. The input is not modified.
     */
    static List<DebtState> order(PayoffStrategy strategy, Collection<DebtState> debts) {
        List<DebtState> ordered = new ArrayList<>(debts);
        ordered.sort(comparatorFor(strategy));
        return ordered;
    }

    static Comparator<DebtState> comparatorFor(PayoffStrategy strategy) {
        return switch (strategy) {
            case AVALANCHE -> AVALANCHE;
            case SNOWBALL -> SNOWBALL;
            case ENTERED -> ENTERED;
            case CUSTOM -> CUSTOM;
        };
    }

    private static int prioritySortKey(DebtState debt) {
        return debt.getCustomPriority() != null ? debt.getCustomPriority() : NO_PRIORITY;
    }
}
