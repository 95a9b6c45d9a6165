package com.flagship.debt_payoff.override;

import com.flagship.debt_payoff.override.dto.ScheduleOverrideRequest;
import com.flagship.debt_payoff.override.dto.ScheduleOverrideResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for schedule overrides.
 */
@RestController
@RequestMapping("/api/schedule-overrides")
@RequiredArgsConstructor
public class ScheduleOverrideController {

    private final ScheduleOverrideService scheduleOverrideService;

    @GetMapping
    public List<ScheduleOverrideResponse> listOverrides() {
        return scheduleOverrideService.listOverrides().stream()
            .map(ScheduleOverrideResponse::from)
            .toList();
    }

    @PutMapping("/{monthIndex}")
    public ResponseEntity<Void> setOverride(@PathVariable("monthIndex") int monthIndex,
                                            @Valid @RequestBody ScheduleOverrideRequest request) {
        scheduleOverrideService.setOverride(monthIndex, request.additionalAmountOrZero());
        return ResponseEntity.noContent().build();
    }
}
