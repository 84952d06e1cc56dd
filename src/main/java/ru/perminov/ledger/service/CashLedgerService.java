package ru.perminov.ledger.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import ru.perminov.ledger.dto.CashTransactionDto;
import ru.perminov.ledger.dto.CashTransactionRequest;
import ru.perminov.ledger.dto.ReversalRequest;
import ru.perminov.ledger.exception.ConflictException;
import ru.perminov.ledger.exception.InsufficientFundsException;
import ru.perminov.ledger.exception.IntegrityException;
import ru.perminov.ledger.exception.NotFoundException;
import ru.perminov.ledger.exception.ValidationException;
import ru.perminov.ledger.model.Account;
import ru.perminov.ledger.model.CashTransaction;
import ru.perminov.ledger.model.CashTransactionType;
import ru.perminov.ledger.repository.AccountRepository;
import ru.perminov.ledger.repository.CashTransactionRepository;
import ru.perminov.ledger.repository.OffsetLimitRequest;
import ru.perminov.ledger.util.RequestChecks;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

import static ru.perminov.ledger.util.FixedPoint.unscale;

/**
 * Manual cash entries against an account. Every entry updates the balance and appends an
 * immutable ledger row carrying the balance after it, in one transaction under the account lock.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CashLedgerService {

    private static final String MANUAL_TYPES = "deposit, withdrawal, drawdown, adjustment";

    private final AccountRepository accountRepository;
    private final CashTransactionRepository cashTransactionRepository;

    @Value("${ledger.history.default-limit:50}")
    private int defaultHistoryLimit;

    @Value("${ledger.history.max-limit:500}")
    private int maxHistoryLimit;

    @Transactional
    public CashTransactionDto record(Long accountId, CashTransactionRequest request) {
        CashTransactionType type = parseType(request.transactionType());
        LocalDate date = RequestChecks.isoDate(request.transactionDate(), "Transaction date");
        long amount = signedAmount(type, request.amount());
        String notes = RequestChecks.optionalText(request.notes(), "Notes", 255);

        Account account = accountRepository.findByIdForUpdate(accountId)
                .orElseThrow(() -> NotFoundException.of("Account", accountId));
        CashTransaction tx = append(account, type, date, amount, notes, null);

        log.info("Cash {} recorded: account={}, amount={}, balanceAfter={}, id={}",
                type.getCode(), accountId, amount, tx.getBalanceAfter(), tx.getId());
        return CashTransactionDto.from(tx);
    }

    /**
     * Cancels a manual entry by appending an adjustment of the opposite sign. The original row stays.
     */
    @Transactional
    public CashTransactionDto reverse(Long transactionId, ReversalRequest request) {
        LocalDate date = RequestChecks.isoDate(request.transactionDate(), "Transaction date");
        String notes = RequestChecks.optionalText(request.notes(), "Notes", 255);

        CashTransaction original = cashTransactionRepository.findById(transactionId)
                .orElseThrow(() -> NotFoundException.of("Cash transaction", transactionId));
        Long accountId = original.getAccount().getId();
        Account account = accountRepository.findByIdForUpdate(accountId)
                .orElseThrow(() -> NotFoundException.of("Account", accountId));

        if (original.getHoldingMovement() != null) {
            throw new ConflictException("Cash transaction " + transactionId
                    + " belongs to a holding movement and cannot be reversed on its own");
        }
        if (original.getReversesTransactionId() != null) {
            throw new ConflictException("Cash transaction " + transactionId + " is itself a reversal");
        }
        if (cashTransactionRepository.existsByReversesTransactionId(transactionId)) {
            throw new ConflictException("Cash transaction " + transactionId + " has already been reversed");
        }

        CashTransaction reversal = append(account, CashTransactionType.ADJUSTMENT, date, -original.getAmount(),
                notes != null ? notes : "Reversal of transaction " + transactionId, transactionId);

        log.info("Cash transaction reversed: original={}, reversal={}, account={}, balanceAfter={}",
                transactionId, reversal.getId(), accountId, reversal.getBalanceAfter());
        return CashTransactionDto.from(reversal);
    }

    @Transactional(readOnly = true)
    public List<CashTransactionDto> history(Long accountId, Integer limit, Integer offset) {
        if (!accountRepository.existsById(accountId)) {
            throw NotFoundException.of("Account", accountId);
        }
        int effectiveLimit = limit == null ? defaultHistoryLimit : limit;
        int effectiveOffset = offset == null ? 0 : offset;
        if (effectiveLimit < 1) {
            throw new ValidationException("Limit must be at least 1");
        }
        if (effectiveOffset < 0) {
            throw new ValidationException("Offset must not be negative");
        }
        OffsetLimitRequest page = OffsetLimitRequest.of(effectiveOffset, Math.min(effectiveLimit, maxHistoryLimit));
        return cashTransactionRepository.findHistory(accountId, page).stream()
                .map(CashTransactionDto::from)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public CashTransactionDto get(Long transactionId) {
        return CashTransactionDto.from(cashTransactionRepository.findById(transactionId)
                .orElseThrow(() -> NotFoundException.of("Cash transaction", transactionId)));
    }

    private CashTransaction append(Account account, CashTransactionType type, LocalDate date, long amount,
                                   String notes, Long reversesTransactionId) {
        long balance = account.getCashBalance();
        if (amount < 0 && -amount > balance) {
            log.warn("Cash {} rejected: account={}, amount={}, cashBalance={}", type.getCode(), account.getId(), amount, balance);
            throw new InsufficientFundsException(String.format("Insufficient funds: %s exceeds available balance %s",
                    unscale(-amount).toPlainString(), unscale(balance).toPlainString()));
        }
        long balanceAfter = Math.addExact(balance, amount);
        account.setCashBalance(balanceAfter);

        CashTransaction tx = CashTransaction.builder()
                .account(account)
                .transactionType(type)
                .transactionDate(date)
                .amount(amount)
                .balanceAfter(balanceAfter)
                .reversesTransactionId(reversesTransactionId)
                .notes(notes)
                .build();
        try {
            return cashTransactionRepository.saveAndFlush(tx);
        } catch (DataIntegrityViolationException e) {
            throw new IntegrityException("Cash transaction rejected by the store: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    private CashTransactionType parseType(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException("Transaction type is required");
        }
        return CashTransactionType.fromCode(raw.trim())
                .filter(CashTransactionType::isManual)
                .orElseThrow(() -> new ValidationException("Transaction type must be one of: " + MANUAL_TYPES));
    }

    private long signedAmount(CashTransactionType type, BigDecimal raw) {
        if (type == CashTransactionType.ADJUSTMENT) {
            RequestChecks.present(raw, "Amount");
            long amount = RequestChecks.scaled(raw, "Amount");
            if (amount == 0) {
                throw new ValidationException("Amount must not be zero");
            }
            return amount;
        }
        RequestChecks.positive(raw, "Amount");
        long amount = RequestChecks.scaled(raw, "Amount");
        if (amount == 0) {
            throw new ValidationException("Amount must be greater than zero");
        }
        return type == CashTransactionType.DEPOSIT ? amount : -amount;
    }
}
