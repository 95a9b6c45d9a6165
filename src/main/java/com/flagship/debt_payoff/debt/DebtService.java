package com.flagship.debt_payoff.debt;

import com.flagship.debt_payoff.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

/**
 * Service for managing the user's debts.
 *
 * New debts are appended after the current last position.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DebtService {

    private final DebtRepository debtRepository;

    /**
     * Lists all debts in entry order.
     */
    @Transactional(readOnly = true)
    public List<Debt> listDebts() {
        return debtRepository.findAllByOrderByPositionAscIdAsc().stream()
            .map(DebtEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public Set<Long> listDebtIds() {
        return Set.copyOf(debtRepository.findAll().stream().map(DebtEntity::getId).toList());
    }

    /**
     * Creates a debt at the end of the entry order.
     *
     * @return the stored debt, including its generated id and position
     */
    @Transactional
    public Debt createDebt(String creditor, BigDecimal balance, double apr,
                           BigDecimal minimumPayment, Integer customPriority) {
        Integer maxPosition = debtRepository.findMaxPosition();
        int position = (maxPosition != null ? maxPosition : 0) + 1;

        DebtEntity saved = debtRepository.save(DebtEntity.create(
            creditor,
            balance,
            apr,
            minimumPayment,
            customPriority,
            position
        ));
        log.info("Created debt: id={}, creditor={}, position={}", saved.getId(), creditor, position);
        return saved.toDomain();
    }

    /**
     * Applies a partial update to a debt.
     *
     * @throws ResourceNotFoundException if the debt does not exist
     */
    @Transactional
    public Debt updateDebt(long debtId, DebtChanges changes) {
        DebtEntity entity = findEntity(debtId);
        entity.updateFrom(changes);
        DebtEntity saved = debtRepository.save(entity);
        log.debug("Updated debt {}", debtId);
        return saved.toDomain();
    }

    /**
     * Deletes a debt. Its payment overrides are removed by the database cascade.
     *
     * @throws ResourceNotFoundException if the debt does not exist
     */
    @Transactional
    public void deleteDebt(long debtId) {
        DebtEntity entity = findEntity(debtId);
        debtRepository.delete(entity);
        log.info("Deleted debt {}", debtId);
    }

    /**
     * Reassigns positions 0..n-1 following the given id order.
     * Unknown ids are skipped without failing the request.
     */
    @Transactional
    public void reorder(List<Long> idsInOrder) {
        for (int position = 0; position < idsInOrder.size(); position++) {
            Long debtId = idsInOrder.get(position);
            if (debtId == null) {
                continue;
            }
            int target = position;
            debtRepository.findById(debtId).ifPresentOrElse(
                entity -> entity.moveTo(target),
                () -> log.debug("Skipping unknown debt {} during reorder", debtId)
            );
        }
        log.info("Reordered {} debts", idsInOrder.size());
    }

    private DebtEntity findEntity(long debtId) {
        return debtRepository.findById(debtId)
            .orElseThrow(() -> new ResourceNotFoundException("Debt not found: " + debtId));
    }
}
