package ru.perminov.ledger.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import ru.perminov.ledger.dto.AccountValuation;
import ru.perminov.ledger.dto.HoldingValuation;
import ru.perminov.ledger.dto.UserDto;
import ru.perminov.ledger.dto.UserPortfolio;
import ru.perminov.ledger.exception.NotFoundException;
import ru.perminov.ledger.model.Account;
import ru.perminov.ledger.model.Currency;
import ru.perminov.ledger.model.Holding;
import ru.perminov.ledger.model.Investment;
import ru.perminov.ledger.model.User;
import ru.perminov.ledger.repository.AccountRepository;
import ru.perminov.ledger.repository.HoldingRepository;
import ru.perminov.ledger.repository.UserRepository;
import ru.perminov.ledger.service.ReferenceDataService.DatedValue;
import ru.perminov.ledger.util.FixedPoint;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static ru.perminov.ledger.util.FixedPoint.unscale;

/**
 * Values holdings at their latest price, converted to the base currency at the latest rate.
 * <p>
 * Missing prices or rates never fail the valuation: the holding is listed with a status
 * and contributes zero to the totals.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ValuationService {

    private final AccountRepository accountRepository;
    private final HoldingRepository holdingRepository;
    private final UserRepository userRepository;
    private final ReferenceDataService referenceDataService;

    @Transactional(readOnly = true)
    public AccountValuation valueAccount(Long accountId) {
        Account account = accountRepository.findById(accountId)
                .orElseThrow(() -> NotFoundException.of("Account", accountId));
        return value(account, referenceDataService.latestRates());
    }

    @Transactional(readOnly = true)
    public UserPortfolio valueUser(Long userId) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> NotFoundException.of("User", userId));
        Map<Long, DatedValue> rates = referenceDataService.latestRates();

        List<AccountValuation> accounts = new ArrayList<>();
        BigDecimal investments = BigDecimal.ZERO;
        BigDecimal cash = BigDecimal.ZERO;
        for (Account account : accountRepository.findByUserIdOrderByAccountTypeAsc(userId)) {
            AccountValuation valuation = value(account, rates);
            accounts.add(valuation);
            investments = investments.add(valuation.getInvestmentsTotal());
            cash = cash.add(valuation.getCashBalance());
        }

        log.debug("Portfolio valued: user={}, accounts={}, investments={}, cash={}", userId, accounts.size(), investments, cash);
        return UserPortfolio.builder()
                .user(UserDto.from(user))
                .valuationDate(LocalDate.now())
                .accounts(accounts)
                .investmentsTotal(investments)
                .cashTotal(cash)
                .grandTotal(investments.add(cash))
                .build();
    }

    private AccountValuation value(Account account, Map<Long, DatedValue> rates) {
        List<HoldingValuation> holdings = new ArrayList<>();
        BigDecimal investments = BigDecimal.ZERO;
        for (Holding holding : holdingRepository.findByAccountIdWithInvestment(account.getId())) {
            HoldingValuation valuation = value(holding, rates);
            holdings.add(valuation);
            investments = investments.add(valuation.getValueBase());
        }

        BigDecimal cash = unscale(account.getCashBalance());
        return AccountValuation.builder()
                .accountId(account.getId())
                .accountType(account.getAccountType())
                .accountRef(account.getAccountRef())
                .cashBalance(cash)
                .warnCash(unscale(account.getWarnCash()))
                .cashWarning(account.getWarnCash() > 0 && account.getCashBalance() < account.getWarnCash())
                .investmentsTotal(investments)
                .accountTotal(investments.add(cash))
                .holdings(holdings)
                .build();
    }

    private HoldingValuation value(Holding holding, Map<Long, DatedValue> rates) {
        Investment investment = holding.getInvestment();
        Currency currency = investment.getCurrency();
        BigDecimal quantity = unscale(holding.getQuantity());
        BigDecimal averageCost = unscale(holding.getAverageCost());

        HoldingValuation.HoldingValuationBuilder result = HoldingValuation.builder()
                .holdingId(holding.getId())
                .investmentId(investment.getId())
                .publicId(investment.getPublicId())
                .description(investment.getDescription())
                .currencyCode(currency.getCode())
                .quantity(quantity)
                .averageCost(averageCost)
                .bookValue(FixedPoint.roundToPence(quantity.multiply(averageCost)))
                .valueBase(BigDecimal.ZERO);

        Optional<DatedValue> price = referenceDataService.latestPrice(investment.getId());
        if (price.isEmpty()) {
            return result.status(HoldingValuation.Status.NO_PRICE).build();
        }
        BigDecimal local = quantity.multiply(price.get().value());
        result.price(price.get().value())
                .priceDate(price.get().date())
                .valueLocal(FixedPoint.roundToPence(local));

        if (currency.isBase()) {
            return result.valueBase(FixedPoint.roundToPence(local))
                    .status(HoldingValuation.Status.VALUED)
                    .build();
        }
        DatedValue rate = rates.get(currency.getId());
        if (rate == null) {
            return result.status(HoldingValuation.Status.NO_RATE).build();
        }
        return result.rate(rate.value())
                .rateDate(rate.date())
                .valueBase(FixedPoint.roundToPence(local.divide(rate.value(), MathContext.DECIMAL128)))
                .status(HoldingValuation.Status.VALUED)
                .build();
    }
}
