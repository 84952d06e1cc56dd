package ru.perminov.ledger.dto;

import lombok.Data;
import ru.perminov.ledger.model.Account;
import ru.perminov.ledger.model.AccountType;

import java.math.BigDecimal;

import static ru.perminov.ledger.util.FixedPoint.unscale;

@Data
public class AccountDto {
    private Long id;
    private Long userId;
    private AccountType accountType;
    private String accountRef;
    private BigDecimal cashBalance;
    private BigDecimal warnCash;
    private long cashBalanceScaled;
    private long warnCashScaled;

    public static AccountDto from(Account account) {
        AccountDto dto = new AccountDto();
        dto.setId(account.getId());
        dto.setUserId(account.getUser().getId());
        dto.setAccountType(account.getAccountType());
        dto.setAccountRef(account.getAccountRef());
        dto.setCashBalance(unscale(account.getCashBalance()));
        dto.setWarnCash(unscale(account.getWarnCash()));
        dto.setCashBalanceScaled(account.getCashBalance());
        dto.setWarnCashScaled(account.getWarnCash());
        return dto;
    }
}
