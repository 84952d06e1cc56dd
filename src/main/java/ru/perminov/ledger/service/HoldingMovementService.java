package ru.perminov.ledger.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import ru.perminov.ledger.dto.AccountDto;
import ru.perminov.ledger.dto.AdjustmentRequest;
import ru.perminov.ledger.dto.HoldingDto;
import ru.perminov.ledger.dto.MovementDto;
import ru.perminov.ledger.dto.MovementRequest;
import ru.perminov.ledger.dto.MovementResult;
import ru.perminov.ledger.exception.InsufficientFundsException;
import ru.perminov.ledger.exception.InsufficientQuantityException;
import ru.perminov.ledger.exception.IntegrityException;
import ru.perminov.ledger.exception.NotFoundException;
import ru.perminov.ledger.exception.ValidationException;
import ru.perminov.ledger.model.Account;
import ru.perminov.ledger.model.CashTransaction;
import ru.perminov.ledger.model.CashTransactionType;
import ru.perminov.ledger.model.Holding;
import ru.perminov.ledger.model.HoldingMovement;
import ru.perminov.ledger.model.MovementType;
import ru.perminov.ledger.repository.AccountRepository;
import ru.perminov.ledger.repository.CashTransactionRepository;
import ru.perminov.ledger.repository.HoldingMovementRepository;
import ru.perminov.ledger.repository.HoldingRepository;
import ru.perminov.ledger.repository.OffsetLimitRequest;
import ru.perminov.ledger.util.FixedPoint;
import ru.perminov.ledger.util.RequestChecks;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

import static ru.perminov.ledger.util.FixedPoint.unscale;

/**
 * Applies buys, sells and quantity adjustments to a holding.
 * <p>
 * Each call is one transaction: the owning account is locked first, then the holding, and the
 * sufficiency checks run against those locked rows. The holding, the account balance, the movement
 * record and its cash ledger row are committed together or not at all.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HoldingMovementService {

    private final HoldingRepository holdingRepository;
    private final AccountRepository accountRepository;
    private final HoldingMovementRepository movementRepository;
    private final CashTransactionRepository cashTransactionRepository;

    @Value("${ledger.history.default-limit:50}")
    private int defaultHistoryLimit;

    @Value("${ledger.history.max-limit:500}")
    private int maxHistoryLimit;

    @Transactional
    public MovementResult process(Long holdingId, MovementRequest request) {
        ValidMovement movement = validate(request);
        Locked locked = lock(holdingId);

        MovementResult result = movement.type() == MovementType.BUY
                ? buy(locked, movement)
                : sell(locked, movement);
        flush();
        return result;
    }

    /**
     * Sets the holding quantity directly, e.g. after a split. Average cost and cash are unchanged.
     */
    @Transactional
    public MovementResult adjust(Long holdingId, AdjustmentRequest request) {
        LocalDate date = RequestChecks.isoDate(request.movementDate(), "Movement date");
        RequestChecks.present(request.newQuantity(), "New quantity");
        long newQuantity = RequestChecks.scaled(request.newQuantity(), "New quantity");
        if (newQuantity <= 0) {
            throw new ValidationException("New quantity must be greater than zero");
        }
        String notes = RequestChecks.optionalText(request.notes(), "Notes", 255);

        Locked locked = lock(holdingId);
        Holding holding = locked.holding();
        long oldQuantity = holding.getQuantity();
        if (newQuantity == oldQuantity) {
            throw new ValidationException("New quantity is the same as the current quantity");
        }

        holding.setQuantity(newQuantity);
        HoldingMovement record = movementRepository.save(HoldingMovement.builder()
                .holding(holding)
                .movementType(MovementType.ADJUSTMENT)
                .movementDate(date)
                .quantity(newQuantity - oldQuantity)
                .movementValue(0L)
                .deductibleCosts(0L)
                .bookCost(0L)
                .notes(notes)
                .build());
        flush();

        log.info("Adjustment applied: holding={}, quantity {} -> {}, movement={}",
                holdingId, oldQuantity, newQuantity, record.getId());
        return result(record, holding, locked.account());
    }

    @Transactional(readOnly = true)
    public List<MovementDto> history(Long holdingId, Integer limit) {
        if (!holdingRepository.existsById(holdingId)) {
            throw NotFoundException.of("Holding", holdingId);
        }
        int effective = limit == null ? defaultHistoryLimit : limit;
        if (effective < 1) {
            throw new ValidationException("Limit must be at least 1");
        }
        return movementRepository.findHistory(holdingId, OffsetLimitRequest.first(Math.min(effective, maxHistoryLimit))).stream()
                .map(MovementDto::from)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public MovementDto get(Long movementId) {
        return MovementDto.from(movementRepository.findById(movementId)
                .orElseThrow(() -> NotFoundException.of("Movement", movementId)));
    }

    private MovementResult buy(Locked locked, ValidMovement m) {
        Holding holding = locked.holding();
        Account account = locked.account();

        long bookCost = m.consideration() - m.deductibleCosts();
        if (m.consideration() > account.getCashBalance()) {
            log.warn("Buy rejected: holding={}, consideration={}, cashBalance={}",
                    holding.getId(), m.consideration(), account.getCashBalance());
            throw new InsufficientFundsException(String.format("Insufficient cash: total consideration %s exceeds available balance %s",
                    unscale(m.consideration()).toPlainString(), unscale(account.getCashBalance()).toPlainString()));
        }

        long newQuantity = Math.addExact(holding.getQuantity(), m.quantity());
        long newAverageCost = weightedAverageCost(holding.getQuantity(), holding.getAverageCost(), m.quantity(), bookCost);
        long newBalance = Math.subtractExact(account.getCashBalance(), m.consideration());

        holding.setQuantity(newQuantity);
        holding.setAverageCost(newAverageCost);
        account.setCashBalance(newBalance);

        HoldingMovement record = movementRepository.save(HoldingMovement.builder()
                .holding(holding)
                .movementType(MovementType.BUY)
                .movementDate(m.date())
                .quantity(m.quantity())
                .movementValue(m.consideration())
                .deductibleCosts(m.deductibleCosts())
                .bookCost(bookCost)
                .revisedAvgCost(newAverageCost)
                .notes(m.notes())
                .build());
        appendCash(account, record, CashTransactionType.BUY, -m.consideration(), newBalance);

        log.info("Buy applied: holding={}, quantity=+{}, consideration={}, bookCost={}, avgCost={}, cashBalance={}",
                holding.getId(), m.quantity(), m.consideration(), bookCost, newAverageCost, newBalance);
        return result(record, holding, account);
    }

    private MovementResult sell(Locked locked, ValidMovement m) {
        Holding holding = locked.holding();
        Account account = locked.account();

        if (m.quantity() > holding.getQuantity()) {
            log.warn("Sell rejected: holding={}, quantity={}, held={}", holding.getId(), m.quantity(), holding.getQuantity());
            throw new InsufficientQuantityException(String.format("Insufficient quantity: sell quantity %s exceeds holding quantity %s",
                    unscale(m.quantity()).toPlainString(), unscale(holding.getQuantity()).toPlainString()));
        }

        long newQuantity = holding.getQuantity() - m.quantity();
        long netProceeds = m.consideration() - m.deductibleCosts();
        long disposedCost = FixedPoint.scale(unscale(m.quantity()).multiply(unscale(holding.getAverageCost())));
        long newBalance = Math.addExact(account.getCashBalance(), netProceeds);

        holding.setQuantity(newQuantity);
        account.setCashBalance(newBalance);

        HoldingMovement record = movementRepository.save(HoldingMovement.builder()
                .holding(holding)
                .movementType(MovementType.SELL)
                .movementDate(m.date())
                .quantity(m.quantity())
                .movementValue(m.consideration())
                .deductibleCosts(m.deductibleCosts())
                .bookCost(disposedCost)
                .notes(m.notes())
                .build());
        appendCash(account, record, CashTransactionType.SELL, netProceeds, newBalance);

        log.info("Sell applied: holding={}, quantity=-{}, netProceeds={}, remaining={}, cashBalance={}",
                holding.getId(), m.quantity(), netProceeds, newQuantity, newBalance);
        return result(record, holding, account);
    }

    /**
     * Cost per unit after adding {@code addedQuantity} units that cost {@code addedBookCost} in total.
     * Worked in decimals so the product of two scaled values cannot overflow, then scaled once.
     */
    static long weightedAverageCost(long quantity, long averageCost, long addedQuantity, long addedBookCost) {
        BigDecimal oldQuantity = unscale(quantity);
        BigDecimal newQuantity = oldQuantity.add(unscale(addedQuantity));
        if (newQuantity.signum() == 0) {
            return 0L;
        }
        BigDecimal totalCost = oldQuantity.multiply(unscale(averageCost)).add(unscale(addedBookCost));
        return FixedPoint.scale(totalCost.divide(newQuantity, MathContext.DECIMAL128));
    }

    private ValidMovement validate(MovementRequest request) {
        if (request.movementType() == null || request.movementType().isBlank()) {
            throw new ValidationException("Movement type is required");
        }
        MovementType type = MovementType.fromCode(request.movementType().trim())
                .filter(t -> t != MovementType.ADJUSTMENT)
                .orElseThrow(() -> new ValidationException("Movement type must be one of: buy, sell"));
        LocalDate date = RequestChecks.isoDate(request.movementDate(), "Movement date");
        RequestChecks.positive(request.quantity(), "Quantity");
        RequestChecks.present(request.totalConsideration(), "Total consideration");

        long quantity = RequestChecks.scaled(request.quantity(), "Quantity");
        if (quantity <= 0) {
            // positive but below the stored precision
            throw new ValidationException("Quantity must be greater than zero");
        }
        RequestChecks.notNegative(request.totalConsideration(), "Total consideration");
        RequestChecks.notNegative(request.deductibleCostsOrZero(), "Deductible costs");
        long consideration = RequestChecks.scaled(request.totalConsideration(), "Total consideration");
        long deductible = RequestChecks.scaled(request.deductibleCostsOrZero(), "Deductible costs");
        if (deductible > consideration) {
            throw new ValidationException("Deductible costs must not exceed total consideration");
        }
        String notes = RequestChecks.optionalText(request.notes(), "Notes", 255);
        return new ValidMovement(type, date, quantity, consideration, deductible, notes);
    }

    private Locked lock(Long holdingId) {
        Long accountId = holdingRepository.findAccountIdById(holdingId)
                .orElseThrow(() -> NotFoundException.of("Holding", holdingId));
        Account account = accountRepository.findByIdForUpdate(accountId)
                .orElseThrow(() -> NotFoundException.of("Account", accountId));
        Holding holding = holdingRepository.findByIdForUpdate(holdingId)
                .orElseThrow(() -> NotFoundException.of("Holding", holdingId));
        return new Locked(account, holding);
    }

    private void appendCash(Account account, HoldingMovement movement, CashTransactionType type, long amount, long balanceAfter) {
        cashTransactionRepository.save(CashTransaction.builder()
                .account(account)
                .holdingMovement(movement)
                .transactionType(type)
                .transactionDate(movement.getMovementDate())
                .amount(amount)
                .balanceAfter(balanceAfter)
                .notes(movement.getNotes())
                .build());
    }

    private void flush() {
        try {
            movementRepository.flush();
        } catch (DataIntegrityViolationException e) {
            throw new IntegrityException("Movement rejected by the store: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    private MovementResult result(HoldingMovement record, Holding holding, Account account) {
        return new MovementResult(MovementDto.from(record), HoldingDto.from(holding), AccountDto.from(account));
    }

    private record Locked(Account account, Holding holding) {
    }

    private record ValidMovement(MovementType type, LocalDate date, long quantity, long consideration,
                                 long deductibleCosts, String notes) {
    }
}
