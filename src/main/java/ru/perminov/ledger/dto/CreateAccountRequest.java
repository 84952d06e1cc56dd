package ru.perminov.ledger.dto;

import java.math.BigDecimal;

public record CreateAccountRequest(String accountType, String accountRef, BigDecimal warnCash) {
}
