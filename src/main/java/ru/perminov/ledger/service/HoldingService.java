package ru.perminov.ledger.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import ru.perminov.ledger.dto.CreateHoldingRequest;
import ru.perminov.ledger.dto.HoldingDto;
import ru.perminov.ledger.dto.UpdateHoldingRequest;
import ru.perminov.ledger.exception.ConflictException;
import ru.perminov.ledger.exception.IntegrityException;
import ru.perminov.ledger.exception.NotFoundException;
import ru.perminov.ledger.exception.ValidationException;
import ru.perminov.ledger.model.Account;
import ru.perminov.ledger.model.Holding;
import ru.perminov.ledger.model.Investment;
import ru.perminov.ledger.repository.AccountRepository;
import ru.perminov.ledger.repository.CashTransactionRepository;
import ru.perminov.ledger.repository.HoldingMovementRepository;
import ru.perminov.ledger.repository.HoldingRepository;
import ru.perminov.ledger.repository.InvestmentRepository;
import ru.perminov.ledger.util.RequestChecks;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Positions of one investment inside one account. Buys and sells go through
 * {@link HoldingMovementService}; {@link #update} here is a manual correction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HoldingService {

    private final HoldingRepository holdingRepository;
    private final AccountRepository accountRepository;
    private final InvestmentRepository investmentRepository;
    private final HoldingMovementRepository movementRepository;
    private final CashTransactionRepository cashTransactionRepository;

    @Transactional(readOnly = true)
    public List<HoldingDto> listByAccount(Long accountId) {
        if (!accountRepository.existsById(accountId)) {
            throw NotFoundException.of("Account", accountId);
        }
        return holdingRepository.findByAccountIdWithInvestment(accountId).stream()
                .map(HoldingDto::from)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public HoldingDto get(Long id) {
        return HoldingDto.from(holdingRepository.findWithInvestmentById(id)
                .orElseThrow(() -> NotFoundException.of("Holding", id)));
    }

    @Transactional
    public HoldingDto create(Long accountId, CreateHoldingRequest request) {
        if (request.investmentId() == null) {
            throw new ValidationException("Investment is required");
        }
        long quantity = nonNegative(request.quantity(), "Quantity");
        long averageCost = nonNegative(request.averageCost(), "Average cost");

        Account account = accountRepository.findById(accountId)
                .orElseThrow(() -> NotFoundException.of("Account", accountId));
        Investment investment = investmentRepository.findById(request.investmentId())
                .orElseThrow(() -> NotFoundException.of("Investment", request.investmentId()));
        if (holdingRepository.existsByAccountIdAndInvestmentId(accountId, investment.getId())) {
            throw new ConflictException("Account " + accountId + " already holds investment " + investment.getId());
        }

        Holding holding = Holding.builder()
                .account(account)
                .investment(investment)
                .quantity(quantity)
                .averageCost(averageCost)
                .build();
        holding = save(holding);
        log.info("Holding created: id={}, account={}, investment={}, quantity={}, averageCost={}",
                holding.getId(), accountId, investment.getId(), quantity, averageCost);
        return get(holding.getId());
    }

    @Transactional
    public HoldingDto update(Long id, UpdateHoldingRequest request) {
        long quantity = nonNegative(request.quantity(), "Quantity");
        long averageCost = nonNegative(request.averageCost(), "Average cost");
        Long accountId = holdingRepository.findAccountIdById(id)
                .orElseThrow(() -> NotFoundException.of("Holding", id));
        // same lock order as the movement processor
        accountRepository.findByIdForUpdate(accountId);
        Holding holding = holdingRepository.findByIdForUpdate(id)
                .orElseThrow(() -> NotFoundException.of("Holding", id));

        log.info("Holding corrected: id={}, quantity {} -> {}, averageCost {} -> {}",
                id, holding.getQuantity(), quantity, holding.getAverageCost(), averageCost);
        holding.setQuantity(quantity);
        holding.setAverageCost(averageCost);
        save(holding);
        return get(id);
    }

    /**
     * Removes a holding with its movement history and the cash rows linked to those movements.
     * The account's cash balance is left as it is: the cash moved, only its trade records go.
     */
    @Transactional
    public void delete(Long id) {
        Long accountId = holdingRepository.findAccountIdById(id)
                .orElseThrow(() -> NotFoundException.of("Holding", id));
        accountRepository.findByIdForUpdate(accountId);
        Holding holding = holdingRepository.findByIdForUpdate(id)
                .orElseThrow(() -> NotFoundException.of("Holding", id));

        int cash = cashTransactionRepository.deleteByHoldingId(id);
        int movements = movementRepository.deleteByHoldingId(id);
        holdingRepository.delete(holding);
        log.warn("Holding deleted: id={}, account={}, quantity={}, movementsRemoved={}, cashTransactionsRemoved={}",
                id, accountId, holding.getQuantity(), movements, cash);
    }

    private long nonNegative(BigDecimal value, String field) {
        RequestChecks.notNegative(value, field);
        return RequestChecks.scaled(value, field);
    }

    private Holding save(Holding holding) {
        try {
            return holdingRepository.saveAndFlush(holding);
        } catch (DataIntegrityViolationException e) {
            throw new IntegrityException("Holding rejected by the store: " + e.getMostSpecificCause().getMessage(), e);
        }
    }
}
