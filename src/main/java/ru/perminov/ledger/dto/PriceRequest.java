package ru.perminov.ledger.dto;

import java.math.BigDecimal;

public record PriceRequest(String priceDate, BigDecimal price) {
}
