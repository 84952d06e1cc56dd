package ru.perminov.ledger.controller;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import ru.perminov.ledger.exception.ErrorKind;
import ru.perminov.ledger.exception.LedgerException;

import java.time.Instant;
import java.util.Map;

/**
 * Translates ledger error kinds into HTTP responses with a uniform body.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<Map<String, Object>> ledger(LedgerException ex) {
        if (ex.getKind() == ErrorKind.INTEGRITY) {
            log.error("Store rejected a write: {}", ex.getMessage(), ex);
        } else {
            log.debug("Request rejected: kind={}, message={}", ex.getKind(), ex.getMessage());
        }
        return body(statusOf(ex.getKind()), ex.getKind(), ex.getMessage());
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<Map<String, Object>> integrity(DataIntegrityViolationException ex) {
        log.error("Store rejected a write", ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, ErrorKind.INTEGRITY, ex.getMostSpecificCause().getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> unreadable(HttpMessageNotReadableException ex) {
        return body(HttpStatus.BAD_REQUEST, ErrorKind.VALIDATION, "Request body is missing or malformed");
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> typeMismatch(MethodArgumentTypeMismatchException ex) {
        return body(HttpStatus.BAD_REQUEST, ErrorKind.VALIDATION, "Parameter " + ex.getName() + " has an invalid value");
    }

    static HttpStatus statusOf(ErrorKind kind) {
        switch (kind) {
            case VALIDATION:
                return HttpStatus.BAD_REQUEST;
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case CONFLICT:
                return HttpStatus.CONFLICT;
            case INSUFFICIENT_FUNDS:
            case INSUFFICIENT_QUANTITY:
                return HttpStatus.UNPROCESSABLE_ENTITY;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    private ResponseEntity<Map<String, Object>> body(HttpStatus status, ErrorKind kind, String message) {
        return ResponseEntity.status(status).body(Map.of(
                "status", "error",
                "kind", kind.name(),
                "message", message == null ? "" : message,
                "ts", Instant.now().toString()
        ));
    }
}
