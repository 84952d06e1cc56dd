package ru.perminov.ledger.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A price or exchange rate as presented to callers.
 */
public record DatedValueDto(Long referenceId, LocalDate date, BigDecimal value, long scaled) {
}
