package ru.perminov.ledger.dto;

public record ReversalRequest(String transactionDate, String notes) {
}
