package com.flagship.debt_payoff.override;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for schedule overrides.
 */
@Repository
public interface ScheduleOverrideRepository extends JpaRepository<ScheduleOverrideEntity, Long> {

    List<ScheduleOverrideEntity> findAllByOrderByMonthIndexAsc();

    Optional<ScheduleOverrideEntity> findByMonthIndex(int monthIndex);
}
