package ru.perminov.ledger.dto;

import java.math.BigDecimal;

public record UpdateHoldingRequest(BigDecimal quantity, BigDecimal averageCost) {
}
