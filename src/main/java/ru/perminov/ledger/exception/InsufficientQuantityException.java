package ru.perminov.ledger.exception;

public class InsufficientQuantityException extends LedgerException {

    public InsufficientQuantityException(String message) {
        super(ErrorKind.INSUFFICIENT_QUANTITY, message);
    }
}
