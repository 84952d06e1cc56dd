package ru.perminov.ledger.dto;

public record CurrencyRequest(String code, String description) {
}
