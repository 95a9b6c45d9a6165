package com.flagship.debt_payoff.settings;

import com.flagship.debt_payoff.settings.dto.SettingsResponse;
import com.flagship.debt_payoff.settings.dto.UpdateSettingsRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for the planner settings.
 */
@RestController
@RequestMapping("/api/settings")
@RequiredArgsConstructor
public class SettingsController {

    private final SettingsService settingsService;

    @GetMapping
    public SettingsResponse getSettings() {
        return SettingsResponse.from(settingsService.getSettings());
    }

    @PutMapping
    public SettingsResponse updateSettings(@Valid @RequestBody UpdateSettingsRequest request) {
        return SettingsResponse.from(settingsService.updateSettings(
            request.getBalanceDate(),
            request.getMonthlyBudget(),
            request.getStrategy()
        ));
    }
}
