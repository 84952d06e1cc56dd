package ru.perminov.ledger.exception;

import lombok.Getter;

/**
 * Base of every error the ledger reports to its callers. The kind tells the caller how to react,
 * the message is safe to show to a user.
 */
@Getter
public abstract class LedgerException extends RuntimeException {

    private final ErrorKind kind;

    protected LedgerException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected LedgerException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
