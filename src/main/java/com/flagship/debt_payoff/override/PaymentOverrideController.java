package com.flagship.debt_payoff.override;

import com.flagship.debt_payoff.override.dto.BulkPaymentOverridesRequest;
import com.flagship.debt_payoff.override.dto.PaymentOverrideResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for payment overrides.
 */
@RestController
@RequestMapping("/api/payment-overrides")
@RequiredArgsConstructor
@Slf4j
public class PaymentOverrideController {

    private final PaymentOverrideService paymentOverrideService;

    /**
     * Lists overrides, optionally restricted to one month.
     */
    @GetMapping
    public List<PaymentOverrideResponse> listOverrides(
            @RequestParam(value = "monthIndex", required = false) Integer monthIndex) {
        List<PaymentOverride> overrides = monthIndex != null
            ? paymentOverrideService.listOverrides(monthIndex)
            : paymentOverrideService.listOverrides();
        return overrides.stream()
            .map(PaymentOverrideResponse::from)
            .toList();
    }

    @PutMapping("/bulk")
    public ResponseEntity<Void> replaceMonth(@Valid @RequestBody BulkPaymentOverridesRequest request) {
        log.info("Received payment overrides for month {}: count={}",
            request.getMonthIndex(), request.getOverrides() != null ? request.getOverrides().size() : 0);
        paymentOverrideService.replaceMonth(request.getMonthIndex(), request.toDomain());
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{monthIndex}/{debtId}")
    public ResponseEntity<Void> deleteOverride(@PathVariable("monthIndex") int monthIndex,
                                               @PathVariable("debtId") long debtId) {
        paymentOverrideService.deleteOverride(monthIndex, debtId);
        return ResponseEntity.noContent().build();
    }
}
