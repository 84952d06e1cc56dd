package ru.perminov.ledger.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import ru.perminov.ledger.dto.AccountDto;
import ru.perminov.ledger.dto.CreateAccountRequest;
import ru.perminov.ledger.dto.UpdateAccountRequest;
import ru.perminov.ledger.exception.ConflictException;
import ru.perminov.ledger.exception.IntegrityException;
import ru.perminov.ledger.exception.NotFoundException;
import ru.perminov.ledger.exception.ValidationException;
import ru.perminov.ledger.model.Account;
import ru.perminov.ledger.model.AccountType;
import ru.perminov.ledger.model.User;
import ru.perminov.ledger.repository.AccountRepository;
import ru.perminov.ledger.repository.CashTransactionRepository;
import ru.perminov.ledger.repository.HoldingMovementRepository;
import ru.perminov.ledger.repository.HoldingRepository;
import ru.perminov.ledger.repository.UserRepository;
import ru.perminov.ledger.util.RequestChecks;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Account lifecycle. The cash balance starts at zero and is never written here; it moves only
 * through {@link HoldingMovementService} and {@link CashLedgerService}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    private final AccountRepository accountRepository;
    private final UserRepository userRepository;
    private final HoldingRepository holdingRepository;
    private final HoldingMovementRepository movementRepository;
    private final CashTransactionRepository cashTransactionRepository;

    @Transactional(readOnly = true)
    public List<AccountDto> listByUser(Long userId) {
        if (!userRepository.existsById(userId)) {
            throw NotFoundException.of("User", userId);
        }
        return accountRepository.findByUserIdOrderByAccountTypeAsc(userId).stream()
                .map(AccountDto::from)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public AccountDto get(Long id) {
        return AccountDto.from(require(id));
    }

    @Transactional
    public AccountDto create(Long userId, CreateAccountRequest request) {
        AccountType type = parseType(request.accountType());
        String ref = RequestChecks.text(request.accountRef(), "Account reference", 15);
        long warnCash = warnCash(request.warnCash());

        User user = userRepository.findById(userId).orElseThrow(() -> NotFoundException.of("User", userId));
        if (accountRepository.existsByUserIdAndAccountType(userId, type)) {
            throw new ConflictException("User " + userId + " already has a " + type + " account");
        }

        Account account = Account.builder()
                .user(user)
                .accountType(type)
                .accountRef(ref)
                .cashBalance(0L)
                .warnCash(warnCash)
                .build();
        try {
            account = accountRepository.saveAndFlush(account);
        } catch (DataIntegrityViolationException e) {
            throw new IntegrityException("Account rejected by the store: " + e.getMostSpecificCause().getMessage(), e);
        }
        log.info("Account created: id={}, user={}, type={}", account.getId(), userId, type);
        return AccountDto.from(account);
    }

    @Transactional
    public AccountDto update(Long id, UpdateAccountRequest request) {
        String ref = RequestChecks.text(request.accountRef(), "Account reference", 15);
        long warnCash = warnCash(request.warnCash());
        // same lock as the cash writers
        Account account = accountRepository.findByIdForUpdate(id)
                .orElseThrow(() -> NotFoundException.of("Account", id));
        account.setAccountRef(ref);
        account.setWarnCash(warnCash);
        log.info("Account updated: id={}, warnCash={}", id, warnCash);
        return AccountDto.from(accountRepository.save(account));
    }

    /**
     * Destructive and audited: removes the account's cash ledger, holding movements and holdings,
     * then the account itself, in one transaction.
     */
    @Transactional
    public void delete(Long id) {
        Account account = accountRepository.findByIdForUpdate(id)
                .orElseThrow(() -> NotFoundException.of("Account", id));
        int cash = cashTransactionRepository.deleteByAccountId(id);
        int movements = movementRepository.deleteByAccountId(id);
        int holdings = holdingRepository.deleteByAccountId(id);
        accountRepository.delete(account);
        log.warn("Account deleted: id={}, type={}, cashBalance={}, holdingsRemoved={}, movementsRemoved={}, cashTransactionsRemoved={}",
                id, account.getAccountType(), account.getCashBalance(), holdings, movements, cash);
    }

    Account require(Long id) {
        return accountRepository.findById(id).orElseThrow(() -> NotFoundException.of("Account", id));
    }

    private AccountType parseType(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException("Account type is required");
        }
        try {
            return AccountType.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Account type must be one of: " + Arrays.stream(AccountType.values())
                    .map(t -> t.name().toLowerCase(Locale.ROOT))
                    .collect(Collectors.joining(", ")));
        }
    }

    private long warnCash(BigDecimal value) {
        if (value == null) {
            return 0L;
        }
        RequestChecks.notNegative(value, "Cash warning threshold");
        return RequestChecks.scaled(value, "Cash warning threshold");
    }
}
