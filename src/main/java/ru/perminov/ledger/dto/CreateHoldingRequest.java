package ru.perminov.ledger.dto;

import java.math.BigDecimal;

public record CreateHoldingRequest(Long investmentId, BigDecimal quantity, BigDecimal averageCost) {
}
