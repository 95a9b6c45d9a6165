package com.flagship.debt_payoff.override;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Service for one-time extra amounts added to a month's payment pool.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScheduleOverrideService {

    private final ScheduleOverrideRepository scheduleOverrideRepository;

    @Transactional(readOnly = true)
    public List<ScheduleOverride> listOverrides() {
        return scheduleOverrideRepository.findAllByOrderByMonthIndexAsc().stream()
            .map(ScheduleOverrideEntity::toDomain)
            .toList();
    }

    /**
     * Sets the extra amount for a month. A zero amount removes the override.
     *
     * @throws IllegalArgumentException if the month is below 1 or the amount is negative
     */
    @Transactional
    public void setOverride(int monthIndex, BigDecimal additionalAmount) {
        if (monthIndex < 1) {
            throw new IllegalArgumentException("monthIndex must be >= 1");
        }
        if (additionalAmount.signum() < 0) {
            throw new IllegalArgumentException("additionalAmount must be >= 0");
        }

        Optional<ScheduleOverrideEntity> existing = scheduleOverrideRepository.findByMonthIndex(monthIndex);
        if (additionalAmount.signum() == 0) {
            existing.ifPresent(override -> {
                scheduleOverrideRepository.delete(override);
                log.info("Removed schedule override for month {}", monthIndex);
            });
            return;
        }

        if (existing.isPresent()) {
            existing.get().changeAmount(additionalAmount);
            scheduleOverrideRepository.save(existing.get());
        } else {
            scheduleOverrideRepository.save(ScheduleOverrideEntity.create(monthIndex, additionalAmount));
        }
        log.info("Set schedule override: month={}, additionalAmount={}", monthIndex, additionalAmount);
    }
}
