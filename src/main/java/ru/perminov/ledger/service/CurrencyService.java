package ru.perminov.ledger.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import ru.perminov.ledger.dto.CurrencyDto;
import ru.perminov.ledger.dto.CurrencyRequest;
import ru.perminov.ledger.exception.ConflictException;
import ru.perminov.ledger.exception.IntegrityException;
import ru.perminov.ledger.exception.NotFoundException;
import ru.perminov.ledger.exception.ValidationException;
import ru.perminov.ledger.model.Currency;
import ru.perminov.ledger.repository.CurrencyRepository;
import ru.perminov.ledger.repository.ExchangeRateRepository;
import ru.perminov.ledger.repository.InvestmentRepository;
import ru.perminov.ledger.util.RequestChecks;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class CurrencyService {

    private static final Pattern CODE = Pattern.compile("^[A-Z]{3}$");

    private final CurrencyRepository currencyRepository;
    private final InvestmentRepository investmentRepository;
    private final ExchangeRateRepository rateRepository;

    @Transactional(readOnly = true)
    public List<CurrencyDto> list() {
        return currencyRepository.findAllByOrderByCodeAsc().stream()
                .map(CurrencyDto::from)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public CurrencyDto get(Long id) {
        return CurrencyDto.from(require(id));
    }

    @Transactional(readOnly = true)
    public Currency base() {
        return currencyRepository.findByCode(Currency.BASE_CODE)
                .orElseThrow(() -> new NotFoundException("Base currency " + Currency.BASE_CODE + " is missing"));
    }

    @Transactional
    public CurrencyDto create(CurrencyRequest request) {
        String code = validCode(request.code());
        String description = RequestChecks.text(request.description(), "Description", 30);
        if (currencyRepository.existsByCode(code)) {
            throw new ConflictException("A currency with code '" + code + "' already exists");
        }
        Currency saved = save(new Currency(null, code, description));
        log.info("Currency created: id={}, code={}", saved.getId(), code);
        return CurrencyDto.from(saved);
    }

    @Transactional
    public CurrencyDto update(Long id, CurrencyRequest request) {
        String code = validCode(request.code());
        String description = RequestChecks.text(request.description(), "Description", 30);
        Currency currency = require(id);

        if (!code.equals(currency.getCode())) {
            if (currency.isBase()) {
                throw new ConflictException("The code of the base currency " + Currency.BASE_CODE + " cannot be changed");
            }
            if (code.equals(Currency.BASE_CODE) || currencyRepository.existsByCode(code)) {
                throw new ConflictException("A currency with code '" + code + "' already exists");
            }
        }
        currency.setCode(code);
        currency.setDescription(description);
        Currency saved = save(currency);
        log.info("Currency updated: id={}, code={}", id, code);
        return CurrencyDto.from(saved);
    }

    /**
     * Removes a currency and its exchange rates. The base currency and any currency an investment
     * is denominated in are kept.
     */
    @Transactional
    public void delete(Long id) {
        Currency currency = require(id);
        if (currency.isBase()) {
            throw new ConflictException("The base currency " + Currency.BASE_CODE + " cannot be deleted");
        }
        if (investmentRepository.existsByCurrencyId(id)) {
            throw new ConflictException("Currency " + currency.getCode() + " is used by one or more investments");
        }
        int rates = rateRepository.deleteByCurrencyId(id);
        currencyRepository.delete(currency);
        log.info("Currency deleted: id={}, code={}, ratesRemoved={}", id, currency.getCode(), rates);
    }

    Currency require(Long id) {
        return currencyRepository.findById(id).orElseThrow(() -> NotFoundException.of("Currency", id));
    }

    private String validCode(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException("Code is required");
        }
        String code = raw.trim().toUpperCase(Locale.ROOT);
        if (!CODE.matcher(code).matches()) {
            throw new ValidationException("Code must be exactly 3 letters");
        }
        return code;
    }

    private Currency save(Currency currency) {
        try {
            return currencyRepository.saveAndFlush(currency);
        } catch (DataIntegrityViolationException e) {
            throw new IntegrityException("Currency rejected by the store: " + e.getMostSpecificCause().getMessage(), e);
        }
    }
}
