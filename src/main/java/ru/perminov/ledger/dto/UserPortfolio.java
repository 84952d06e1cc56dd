package ru.perminov.ledger.dto;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Valuation of everything a household member holds, in the base currency.
 */
@Data
@Builder
public class UserPortfolio {
    private UserDto user;
    private LocalDate valuationDate;
    private List<AccountValuation> accounts;
    private BigDecimal investmentsTotal;
    private BigDecimal cashTotal;
    private BigDecimal grandTotal;
}
