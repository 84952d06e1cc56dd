package ru.perminov.ledger.exception;

public class InsufficientFundsException extends LedgerException {

    public InsufficientFundsException(String message) {
        super(ErrorKind.INSUFFICIENT_FUNDS, message);
    }
}
