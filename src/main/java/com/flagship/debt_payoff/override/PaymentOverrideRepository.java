package com.flagship.debt_payoff.override;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for payment overrides.
 */
@Repository
public interface PaymentOverrideRepository extends JpaRepository<PaymentOverrideEntity, Long> {

    List<PaymentOverrideEntity> findAllByOrderByMonthIndexAscDebtIdAsc();

    List<PaymentOverrideEntity> findByMonthIndexOrderByDebtIdAsc(int monthIndex);

    Optional<PaymentOverrideEntity> findByMonthIndexAndDebtId(int monthIndex, long debtId);
}
