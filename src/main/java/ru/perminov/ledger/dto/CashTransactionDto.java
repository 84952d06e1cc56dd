package ru.perminov.ledger.dto;

import lombok.Data;
import ru.perminov.ledger.model.CashTransaction;
import ru.perminov.ledger.model.CashTransactionType;
import ru.perminov.ledger.model.HoldingMovement;

import java.math.BigDecimal;
import java.time.LocalDate;

import static ru.perminov.ledger.util.FixedPoint.unscale;

@Data
public class CashTransactionDto {
    private Long id;
    private Long accountId;
    private Long holdingMovementId;
    private CashTransactionType transactionType;
    private LocalDate transactionDate;
    private BigDecimal amount;
    private BigDecimal balanceAfter;
    private Long reversesTransactionId;
    private String notes;
    // trade detail of the linked movement, null on manual rows
    private BigDecimal movementQuantity;
    private BigDecimal movementTotalConsideration;
    private BigDecimal movementDeductibleCosts;
    private BigDecimal movementRevisedAvgCost;

    public static CashTransactionDto from(CashTransaction tx) {
        CashTransactionDto dto = new CashTransactionDto();
        dto.setId(tx.getId());
        dto.setAccountId(tx.getAccount().getId());
        dto.setTransactionType(tx.getTransactionType());
        dto.setTransactionDate(tx.getTransactionDate());
        dto.setAmount(unscale(tx.getAmount()));
        dto.setBalanceAfter(unscale(tx.getBalanceAfter()));
        dto.setReversesTransactionId(tx.getReversesTransactionId());
        dto.setNotes(tx.getNotes());
        HoldingMovement movement = tx.getHoldingMovement();
        if (movement != null) {
            dto.setHoldingMovementId(movement.getId());
            dto.setMovementQuantity(unscale(movement.getQuantity()));
            dto.setMovementTotalConsideration(unscale(movement.getMovementValue()));
            dto.setMovementDeductibleCosts(unscale(movement.getDeductibleCosts()));
            dto.setMovementRevisedAvgCost(movement.getRevisedAvgCost() != null ? unscale(movement.getRevisedAvgCost()) : null);
        }
        return dto;
    }
}
