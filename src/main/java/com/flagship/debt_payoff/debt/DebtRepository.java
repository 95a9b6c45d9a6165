package com.flagship.debt_payoff.debt;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for debt persistence.
 */
@Repository
public interface DebtRepository extends JpaRepository<DebtEntity, Long> {

    List<DebtEntity> findAllByOrderByPositionAscIdAsc();

    /**
     * Highest position in use, or null when there are no debts.
     */
    @Query("SELECT MAX(d.position) FROM DebtEntity d")
    Integer findMaxPosition();
}
