package ru.perminov.ledger.exception;

/**
 * The store rejected a write that passed every application-level check.
 * Points at a mismatch between the service rules and the schema.
 */
public class IntegrityException extends LedgerException {

    public IntegrityException(String message, Throwable cause) {
        super(ErrorKind.INTEGRITY, message, cause);
    }
}
