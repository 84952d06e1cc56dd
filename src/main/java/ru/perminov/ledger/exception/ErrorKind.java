package ru.perminov.ledger.exception;

public enum ErrorKind {
    VALIDATION,
    NOT_FOUND,
    CONFLICT,
    INSUFFICIENT_FUNDS,
    INSUFFICIENT_QUANTITY,
    INTEGRITY
}
