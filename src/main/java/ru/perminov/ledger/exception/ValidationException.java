package ru.perminov.ledger.exception;

public class ValidationException extends LedgerException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }
}
