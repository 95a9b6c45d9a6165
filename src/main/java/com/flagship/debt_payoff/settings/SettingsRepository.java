package com.flagship.debt_payoff.settings;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for the single settings row.
 */
@Repository
public interface SettingsRepository extends JpaRepository<SettingsEntity, Integer> {
}
