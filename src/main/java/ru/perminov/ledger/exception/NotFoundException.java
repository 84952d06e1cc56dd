package ru.perminov.ledger.exception;

public class NotFoundException extends LedgerException {

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }

    public static NotFoundException of(String entity, Long id) {
        return new NotFoundException(entity + " not found: " + id);
    }
}
