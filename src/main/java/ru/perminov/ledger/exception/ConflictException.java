package ru.perminov.ledger.exception;

public class ConflictException extends LedgerException {

    public ConflictException(String message) {
        super(ErrorKind.CONFLICT, message);
    }
}
