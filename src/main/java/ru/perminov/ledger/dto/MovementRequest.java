package ru.perminov.ledger.dto;

import java.math.BigDecimal;

/**
 * Buy or sell against a holding. Amounts are decimals in the investment's currency;
 * {@code deductibleCosts} defaults to zero and {@code notes} is optional.
 */
public record MovementRequest(String movementType,
                              String movementDate,
                              BigDecimal quantity,
                              BigDecimal totalConsideration,
                              BigDecimal deductibleCosts,
                              String notes) {

    public BigDecimal deductibleCostsOrZero() {
        return deductibleCosts != null ? deductibleCosts : BigDecimal.ZERO;
    }
}
