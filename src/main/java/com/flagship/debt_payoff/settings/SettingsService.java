package com.flagship.debt_payoff.settings;

import com.flagship.debt_payoff.simulation.PayoffStrategy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;

/**
 * Service for reading and updating the planner settings.
 *
 * The settings row is created with defaults on first access, with today's
 * date as the balance date.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SettingsService {

    private final SettingsRepository settingsRepository;
    private final Clock clock;

    @Value("${planner.defaults.strategy:avalanche}")
    private String defaultStrategy;

    @Value("${planner.defaults.monthly-budget:0.00}")
    private BigDecimal defaultMonthlyBudget;

    @Transactional
    public PlannerSettings getSettings() {
        return loadOrCreate().toDomain();
    }

    /**
     * Applies a partial update. Null arguments leave the stored value unchanged.
     *
     * @throws IllegalArgumentException if the strategy is not one of the known names
     */
    @Transactional
    public PlannerSettings updateSettings(LocalDate balanceDate, BigDecimal monthlyBudget, String strategy) {
        if (strategy != null && !PayoffStrategy.isKnown(strategy)) {
            throw new IllegalArgumentException("Invalid strategy");
        }

        SettingsEntity entity = loadOrCreate();
        if (balanceDate != null) {
            entity.changeBalanceDate(balanceDate);
        }
        if (monthlyBudget != null) {
            entity.changeMonthlyBudget(monthlyBudget);
        }
        if (strategy != null) {
            entity.changeStrategy(strategy);
        }

        SettingsEntity saved = settingsRepository.save(entity);
        log.info("Updated settings: balanceDate={}, monthlyBudget={}, strategy={}",
            saved.getBalanceDate(), saved.getMonthlyBudget(), saved.getStrategy());
        return saved.toDomain();
    }

    private SettingsEntity loadOrCreate() {
        return settingsRepository.findById(SettingsEntity.SINGLETON_ID)
            .orElseGet(() -> {
                log.info("No settings stored yet, creating defaults");
                return settingsRepository.save(SettingsEntity.defaults(
                    LocalDate.now(clock), defaultMonthlyBudget, defaultStrategy));
            });
    }
}
