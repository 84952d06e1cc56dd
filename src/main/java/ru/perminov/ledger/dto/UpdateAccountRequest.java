package ru.perminov.ledger.dto;

import java.math.BigDecimal;

public record UpdateAccountRequest(String accountRef, BigDecimal warnCash) {
}
