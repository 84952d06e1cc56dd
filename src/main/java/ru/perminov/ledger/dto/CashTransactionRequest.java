package ru.perminov.ledger.dto;

import java.math.BigDecimal;

/**
 * Manual cash entry. {@code amount} is positive for deposit, withdrawal and drawdown;
 * for an adjustment its sign is the direction of the balance change.
 */
public record CashTransactionRequest(String transactionType,
                                     String transactionDate,
                                     BigDecimal amount,
                                     String notes) {
}
