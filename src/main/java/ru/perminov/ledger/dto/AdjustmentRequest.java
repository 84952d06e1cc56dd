package ru.perminov.ledger.dto;

import java.math.BigDecimal;

/**
 * Direct quantity change of a holding, e.g. after a share split or consolidation.
 */
public record AdjustmentRequest(String movementDate, BigDecimal newQuantity, String notes) {
}
