package ru.perminov.ledger.service;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import ru.perminov.ledger.LedgerTestSupport;
import ru.perminov.ledger.dto.AccountDto;
import ru.perminov.ledger.dto.CreateAccountRequest;
import ru.perminov.ledger.dto.HoldingDto;
import ru.perminov.ledger.dto.MovementRequest;
import ru.perminov.ledger.dto.UpdateAccountRequest;
import ru.perminov.ledger.exception.ConflictException;
import ru.perminov.ledger.exception.NotFoundException;
import ru.perminov.ledger.exception.ValidationException;
import ru.perminov.ledger.model.AccountType;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class AccountServiceTest extends LedgerTestSupport {

    @Autowired
    private HoldingMovementService movementService;

    @Test
    void testNewAccountStartsWithoutCash() {
        Long userId = user("NA").getId();

        AccountDto account = accountService.create(userId, new CreateAccountRequest("ISA", " ISA-001 ", new BigDecimal("250")));

        assertEquals(AccountType.ISA, account.getAccountType());
        assertEquals("ISA-001", account.getAccountRef());
        assertAmount("0", account.getCashBalance());
        assertAmount("250", account.getWarnCash());
        assertEquals(userId, account.getUserId());
    }

    @Test
    void testOneAccountPerTypePerUser() {
        Long first = user("U1").getId();
        Long second = user("U2").getId();
        account(first, "sipp");

        assertThrows(ConflictException.class, () -> account(first, "sipp"));
        assertNotNull(account(second, "sipp").getId());
        ValidationException ex = assertThrows(ValidationException.class, () -> account(first, "pension"));
        assertEquals("Account type must be one of: trading, isa, sipp", ex.getMessage());
        assertThrows(NotFoundException.class, () -> account(-1L, "isa"));
    }

    @Test
    void testUpdateTouchesReferenceAndThresholdOnly() {
        Long accountId = account(user("UT").getId(), "trading").getId();
        deposit(accountId, "75");

        AccountDto updated = accountService.update(accountId, new UpdateAccountRequest("NEW-REF", new BigDecimal("10")));

        assertEquals("NEW-REF", updated.getAccountRef());
        assertAmount("10", updated.getWarnCash());
        assertAmount("75", updated.getCashBalance());
        assertThrows(ValidationException.class,
                () -> accountService.update(accountId, new UpdateAccountRequest("NEW-REF", new BigDecimal("-1"))));
    }

    @Test
    void testDeleteCascadesToHoldingsAndHistory() {
        Long userId = user("DC").getId();
        Long accountId = account(userId, "trading").getId();
        Long keptAccountId = account(userId, "isa").getId();
        deposit(accountId, "1000");
        deposit(keptAccountId, "1000");
        Long investmentId = investment(baseCurrencyId(), "Juliet Foods").getId();
        HoldingDto holding = holding(accountId, investmentId, "0", "0");
        HoldingDto kept = holding(keptAccountId, investmentId, "0", "0");
        movementService.process(holding.getId(), new MovementRequest("buy", "2024-01-02", BigDecimal.TEN, BigDecimal.TEN, null, null));
        movementService.process(kept.getId(), new MovementRequest("buy", "2024-01-02", BigDecimal.TEN, BigDecimal.TEN, null, null));

        accountService.delete(accountId);

        assertFalse(accountRepository.existsById(accountId));
        assertFalse(holdingRepository.existsById(holding.getId()));
        assertEquals(0, movementRepository.countByHoldingId(holding.getId()));
        assertEquals(0, cashTransactionRepository.countByAccountId(accountId));

        assertTrue(holdingRepository.existsById(kept.getId()));
        assertEquals(1, movementRepository.countByHoldingId(kept.getId()));
        assertEquals(2, cashTransactionRepository.countByAccountId(keptAccountId));
        assertThrows(NotFoundException.class, () -> accountService.delete(accountId));
    }

    @Test
    void testDeleteUserRemovesAccounts() {
        Long userId = user("DU").getId();
        Long accountId = account(userId, "trading").getId();
        deposit(accountId, "5");

        userService.delete(userId);

        assertFalse(userRepository.existsById(userId));
        assertFalse(accountRepository.existsById(accountId));
        assertThrows(NotFoundException.class, () -> accountService.listByUser(userId));
    }
}
