package ru.perminov.ledger.dto;

import lombok.Data;
import ru.perminov.ledger.model.HoldingMovement;
import ru.perminov.ledger.model.MovementType;

import java.math.BigDecimal;
import java.time.LocalDate;

import static ru.perminov.ledger.util.FixedPoint.unscale;

@Data
public class MovementDto {
    private Long id;
    private Long holdingId;
    private MovementType movementType;
    private LocalDate movementDate;
    private BigDecimal quantity;
    private BigDecimal movementValue;
    private BigDecimal deductibleCosts;
    private BigDecimal bookCost;
    private BigDecimal revisedAvgCost;
    private String notes;

    public static MovementDto from(HoldingMovement movement) {
        MovementDto dto = new MovementDto();
        dto.setId(movement.getId());
        dto.setHoldingId(movement.getHolding().getId());
        dto.setMovementType(movement.getMovementType());
        dto.setMovementDate(movement.getMovementDate());
        dto.setQuantity(unscale(movement.getQuantity()));
        dto.setMovementValue(unscale(movement.getMovementValue()));
        dto.setDeductibleCosts(unscale(movement.getDeductibleCosts()));
        dto.setBookCost(unscale(movement.getBookCost()));
        if (movement.getRevisedAvgCost() != null) {
            dto.setRevisedAvgCost(unscale(movement.getRevisedAvgCost()));
        }
        dto.setNotes(movement.getNotes());
        return dto;
    }
}
