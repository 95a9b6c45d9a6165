package com.flagship.debt_payoff.override;

import com.flagship.debt_payoff.debt.DebtService;
import com.flagship.debt_payoff.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Service for fixed per-debt payments in a given month.
 *
 * Overrides are managed a month at a time: saving a month replaces its whole set.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentOverrideService {

    private final PaymentOverrideRepository paymentOverrideRepository;
    private final DebtService debtService;

    @Transactional(readOnly = true)
    public List<PaymentOverride> listOverrides() {
        return paymentOverrideRepository.findAllByOrderByMonthIndexAscDebtIdAsc().stream()
            .map(PaymentOverrideEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<PaymentOverride> listOverrides(int monthIndex) {
        return paymentOverrideRepository.findByMonthIndexOrderByDebtIdAsc(monthIndex).stream()
            .map(PaymentOverrideEntity::toDomain)
            .toList();
    }

    /**
     * Replaces every override of a month with the given entries.
     *
     * Existing overrides for listed debts are updated in place, the rest of the
     * month's overrides are deleted.
     *
     * @throws IllegalArgumentException for a month below 1, a non-positive or duplicate
     *                                  debt id, a negative amount, or a debt id that does not exist
     */
    @Transactional
    public void replaceMonth(int monthIndex, List<PaymentOverride> entries) {
        if (monthIndex < 1) {
            throw new IllegalArgumentException("monthIndex must be >= 1");
        }

        Set<Long> seen = new HashSet<>();
        for (PaymentOverride entry : entries) {
            if (entry.getDebtId() <= 0) {
                throw new IllegalArgumentException("debtId must be > 0");
            }
            if (entry.getAmount().signum() < 0) {
                throw new IllegalArgumentException("amount must be >= 0");
            }
            if (!seen.add(entry.getDebtId())) {
                throw new IllegalArgumentException("Duplicate debtId provided for month");
            }
        }

        Set<Long> knownDebtIds = debtService.listDebtIds();
        List<Long> missing = entries.stream()
            .map(PaymentOverride::getDebtId)
            .filter(debtId -> !knownDebtIds.contains(debtId))
            .toList();
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("Unknown debt ids: " + missing);
        }

        Map<Long, PaymentOverrideEntity> existing = paymentOverrideRepository
            .findByMonthIndexOrderByDebtIdAsc(monthIndex).stream()
            .collect(Collectors.toMap(PaymentOverrideEntity::getDebtId, Function.identity()));

        for (PaymentOverride entry : entries) {
            PaymentOverrideEntity override = existing.remove(entry.getDebtId());
            if (override == null) {
                override = PaymentOverrideEntity.create(monthIndex, entry.getDebtId(), entry.getAmount(), entry.getNote());
            } else {
                override.change(entry.getAmount(), entry.getNote());
            }
            paymentOverrideRepository.save(override);
        }
        paymentOverrideRepository.deleteAll(existing.values());

        log.info("Replaced payment overrides: month={}, kept={}, removed={}",
            monthIndex, entries.size(), existing.size());
    }

    /**
     * Deletes the override of one debt in one month.
     *
     * @throws ResourceNotFoundException if no such override exists
     */
    @Transactional
    public void deleteOverride(int monthIndex, long debtId) {
        if (monthIndex < 1) {
            throw new IllegalArgumentException("monthIndex must be >= 1");
        }
        if (debtId <= 0) {
            throw new IllegalArgumentException("debtId must be > 0");
        }
        PaymentOverrideEntity override = paymentOverrideRepository.findByMonthIndexAndDebtId(monthIndex, debtId)
            .orElseThrow(() -> new ResourceNotFoundException("Override not found"));
        paymentOverrideRepository.delete(override);
        log.info("Deleted payment override: month={}, debtId={}", monthIndex, debtId);
    }
}
