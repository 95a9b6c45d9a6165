package com.flagship.debt_payoff.debt;

import com.flagship.debt_payoff.debt.dto.CreateDebtRequest;
import com.flagship.debt_payoff.debt.dto.DebtResponse;
import com.flagship.debt_payoff.debt.dto.ReorderDebtsRequest;
import com.flagship.debt_payoff.debt.dto.UpdateDebtRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for debts.
 */
@RestController
@RequestMapping("/api/debts")
@RequiredArgsConstructor
@Slf4j
public class DebtController {

    private final DebtService debtService;

    @GetMapping
    public List<DebtResponse> listDebts() {
        return debtService.listDebts().stream()
            .map(DebtResponse::from)
            .toList();
    }

    @PostMapping
    public ResponseEntity<DebtResponse> createDebt(@Valid @RequestBody CreateDebtRequest request) {
        log.info("Received debt creation request: creditor={}, balance={}", request.getCreditor(), request.getBalance());

        Debt debt = debtService.createDebt(
            request.getCreditor(),
            request.getBalance(),
            request.getApr().doubleValue(),
            request.getMinimumPayment(),
            request.getCustomPriority()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(DebtResponse.from(debt));
    }

    @PutMapping("/{id}")
    public DebtResponse updateDebt(@PathVariable("id") long id, @Valid @RequestBody UpdateDebtRequest request) {
        return DebtResponse.from(debtService.updateDebt(id, request.toChanges()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteDebt(@PathVariable("id") long id) {
        debtService.deleteDebt(id);
        return ResponseEntity.noContent().build();
    }

    /**
     * Reassigns entry positions. Unknown ids are ignored.
     */
    @PostMapping("/reorder")
    public ResponseEntity<Void> reorderDebts(@Valid @RequestBody ReorderDebtsRequest request) {
        debtService.reorder(request.getIdsInOrder());
        return ResponseEntity.noContent().build();
    }
}
