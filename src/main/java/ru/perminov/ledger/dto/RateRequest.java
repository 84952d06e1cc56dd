package ru.perminov.ledger.dto;

import java.math.BigDecimal;

public record RateRequest(String rateDate, BigDecimal rate) {
}
