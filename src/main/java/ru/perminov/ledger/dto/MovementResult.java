package ru.perminov.ledger.dto;

/**
 * Outcome of a movement as committed. Another writer may have changed the holding or account
 * since; re-read when freshness matters.
 */
public record MovementResult(MovementDto movement, HoldingDto holding, AccountDto account) {
}
