package ru.perminov.ledger.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import ru.perminov.ledger.exception.NotFoundException;
import ru.perminov.ledger.exception.ValidationException;
import ru.perminov.ledger.model.Currency;
import ru.perminov.ledger.model.ExchangeRate;
import ru.perminov.ledger.model.Investment;
import ru.perminov.ledger.model.Price;
import ru.perminov.ledger.repository.CurrencyRepository;
import ru.perminov.ledger.repository.ExchangeRateRepository;
import ru.perminov.ledger.repository.InvestmentRepository;
import ru.perminov.ledger.repository.OffsetLimitRequest;
import ru.perminov.ledger.repository.PriceRepository;
import ru.perminov.ledger.util.FixedPoint;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Latest and point-in-time prices and exchange rates. Absence of data is a normal result.
 * <p>
 * Writes follow last-write-wins per date: a second value for the same instrument and date
 * replaces the first.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReferenceDataService {

    /** Implicit rate of the base currency against itself. */
    public static final long BASE_RATE_SCALED = FixedPoint.FACTOR;

    private final PriceRepository priceRepository;
    private final ExchangeRateRepository rateRepository;
    private final InvestmentRepository investmentRepository;
    private final CurrencyRepository currencyRepository;

    @Value("${ledger.history.max-limit:500}")
    private int maxHistoryLimit;

    @Transactional(readOnly = true)
    public Optional<DatedValue> latestPrice(Long investmentId) {
        requireInvestment(investmentId);
        return priceRepository.findFirstByInvestmentIdOrderByPriceDateDesc(investmentId)
                .map(p -> new DatedValue(p.getPriceDate(), p.getPrice()));
    }

    @Transactional(readOnly = true)
    public Optional<DatedValue> priceOnDate(Long investmentId, LocalDate date) {
        requireInvestment(investmentId);
        return priceRepository.findByInvestmentIdAndPriceDate(investmentId, date)
                .map(p -> new DatedValue(p.getPriceDate(), p.getPrice()));
    }

    @Transactional(readOnly = true)
    public List<DatedValue> priceHistory(Long investmentId, int limit) {
        requireInvestment(investmentId);
        return priceRepository.findHistory(investmentId, OffsetLimitRequest.first(clamp(limit))).stream()
                .map(p -> new DatedValue(p.getPriceDate(), p.getPrice()))
                .collect(Collectors.toList());
    }

    /**
     * The base currency is never looked up and always yields exactly 1.0 with no date.
     */
    @Transactional(readOnly = true)
    public Optional<DatedValue> latestRate(Long currencyId) {
        Currency currency = requireCurrency(currencyId);
        if (currency.isBase()) {
            return Optional.of(new DatedValue(null, BASE_RATE_SCALED));
        }
        return rateRepository.findFirstByCurrencyIdOrderByRateDateDesc(currencyId)
                .map(r -> new DatedValue(r.getRateDate(), r.getRate()));
    }

    @Transactional(readOnly = true)
    public Optional<DatedValue> rateOnDate(Long currencyId, LocalDate date) {
        Currency currency = requireCurrency(currencyId);
        if (currency.isBase()) {
            return Optional.of(new DatedValue(date, BASE_RATE_SCALED));
        }
        return rateRepository.findByCurrencyIdAndRateDate(currencyId, date)
                .map(r -> new DatedValue(r.getRateDate(), r.getRate()));
    }

    @Transactional(readOnly = true)
    public List<DatedValue> rateHistory(Long currencyId, int limit) {
        requireCurrency(currencyId);
        return rateRepository.findHistory(currencyId, OffsetLimitRequest.first(clamp(limit))).stream()
                .map(r -> new DatedValue(r.getRateDate(), r.getRate()))
                .collect(Collectors.toList());
    }

    /**
     * Newest rate of every non-base currency, keyed by currency id, in one read.
     */
    @Transactional(readOnly = true)
    public Map<Long, DatedValue> latestRates() {
        Map<Long, DatedValue> rates = new HashMap<>();
        for (ExchangeRate r : rateRepository.findLatestPerCurrency()) {
            rates.put(r.getCurrency().getId(), new DatedValue(r.getRateDate(), r.getRate()));
        }
        return rates;
    }

    @Transactional
    public DatedValue upsertPrice(Long investmentId, LocalDate date, BigDecimal price) {
        if (date == null) {
            throw new ValidationException("Price date is required");
        }
        long scaled = scalePositive(price, "Price");
        Investment investment = requireInvestment(investmentId);

        Price row = priceRepository.findByInvestmentIdAndPriceDate(investmentId, date)
                .orElseGet(() -> Price.builder().investment(investment).priceDate(date).build());
        Long previous = row.getId() != null ? row.getPrice() : null;
        row.setPrice(scaled);
        priceRepository.save(row);
        log.info("Price stored: investment={}, date={}, price={}, replaced={}", investmentId, date, scaled, previous);
        return new DatedValue(date, scaled);
    }

    @Transactional
    public DatedValue upsertRate(Long currencyId, LocalDate date, BigDecimal rate) {
        if (date == null) {
            throw new ValidationException("Rate date is required");
        }
        long scaled = scalePositive(rate, "Rate");
        Currency currency = requireCurrency(currencyId);
        if (currency.isBase()) {
            throw new ValidationException("The base currency " + Currency.BASE_CODE + " has no exchange rate");
        }

        ExchangeRate row = rateRepository.findByCurrencyIdAndRateDate(currencyId, date)
                .orElseGet(() -> ExchangeRate.builder().currency(currency).rateDate(date).build());
        Long previous = row.getId() != null ? row.getRate() : null;
        row.setRate(scaled);
        rateRepository.save(row);
        log.info("Exchange rate stored: currency={}, date={}, rate={}, replaced={}", currency.getCode(), date, scaled, previous);
        return new DatedValue(date, scaled);
    }

    private long scalePositive(BigDecimal value, String field) {
        if (value == null) {
            throw new ValidationException(field + " is required");
        }
        long scaled;
        try {
            scaled = FixedPoint.scale(value);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(field + " is out of range");
        }
        if (scaled <= 0) {
            throw new ValidationException(field + " must be greater than zero");
        }
        return scaled;
    }

    private int clamp(int limit) {
        if (limit < 1) {
            throw new ValidationException("Limit must be at least 1");
        }
        return Math.min(limit, maxHistoryLimit);
    }

    private Investment requireInvestment(Long investmentId) {
        return investmentRepository.findById(investmentId)
                .orElseThrow(() -> NotFoundException.of("Investment", investmentId));
    }

    private Currency requireCurrency(Long currencyId) {
        return currencyRepository.findById(currencyId)
                .orElseThrow(() -> NotFoundException.of("Currency", currencyId));
    }

    /**
     * A date and a x10000 value. The date is null for the implicit base currency rate.
     */
    public record DatedValue(LocalDate date, long scaled) {

        public BigDecimal value() {
            return FixedPoint.unscale(scaled);
        }
    }
}
