package ru.perminov.ledger.dto;

import lombok.Builder;
import lombok.Data;
import ru.perminov.ledger.model.AccountType;

import java.math.BigDecimal;
import java.util.List;

@Data
@Builder
public class AccountValuation {
    private Long accountId;
    private AccountType accountType;
    private String accountRef;
    private BigDecimal cashBalance;
    private BigDecimal warnCash;
    private boolean cashWarning;
    private BigDecimal investmentsTotal;
    private BigDecimal accountTotal;
    private List<HoldingValuation> holdings;
}
