package ru.perminov.ledger;

import org.junit.jupiter.api.AfterEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import ru.perminov.ledger.dto.AccountDto;
import ru.perminov.ledger.dto.CashTransactionRequest;
import ru.perminov.ledger.dto.CreateAccountRequest;
import ru.perminov.ledger.dto.CreateHoldingRequest;
import ru.perminov.ledger.dto.CurrencyDto;
import ru.perminov.ledger.dto.CurrencyRequest;
import ru.perminov.ledger.dto.HoldingDto;
import ru.perminov.ledger.dto.InvestmentDto;
import ru.perminov.ledger.dto.InvestmentRequest;
import ru.perminov.ledger.dto.UserDto;
import ru.perminov.ledger.dto.UserRequest;
import ru.perminov.ledger.model.Currency;
import ru.perminov.ledger.repository.AccountRepository;
import ru.perminov.ledger.repository.CashTransactionRepository;
import ru.perminov.ledger.repository.CurrencyRepository;
import ru.perminov.ledger.repository.ExchangeRateRepository;
import ru.perminov.ledger.repository.HoldingMovementRepository;
import ru.perminov.ledger.repository.HoldingRepository;
import ru.perminov.ledger.repository.InvestmentRepository;
import ru.perminov.ledger.repository.InvestmentTypeRepository;
import ru.perminov.ledger.repository.PriceRepository;
import ru.perminov.ledger.repository.UserRepository;
import ru.perminov.ledger.service.AccountService;
import ru.perminov.ledger.service.CashLedgerService;
import ru.perminov.ledger.service.CurrencyService;
import ru.perminov.ledger.service.HoldingService;
import ru.perminov.ledger.service.InvestmentService;
import ru.perminov.ledger.service.UserService;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Runs against the in-memory database without a surrounding test transaction, so every service
 * call commits on its own as it does in production. Rows are removed after each test; the seeded
 * base currency and investment types stay.
 */
@SpringBootTest
public abstract class LedgerTestSupport {

    @Autowired protected UserService userService;
    @Autowired protected AccountService accountService;
    @Autowired protected CurrencyService currencyService;
    @Autowired protected InvestmentService investmentService;
    @Autowired protected HoldingService holdingService;
    @Autowired protected CashLedgerService cashLedgerService;

    @Autowired protected UserRepository userRepository;
    @Autowired protected AccountRepository accountRepository;
    @Autowired protected CurrencyRepository currencyRepository;
    @Autowired protected InvestmentTypeRepository investmentTypeRepository;
    @Autowired protected InvestmentRepository investmentRepository;
    @Autowired protected PriceRepository priceRepository;
    @Autowired protected ExchangeRateRepository rateRepository;
    @Autowired protected HoldingRepository holdingRepository;
    @Autowired protected HoldingMovementRepository movementRepository;
    @Autowired protected CashTransactionRepository cashTransactionRepository;

    @AfterEach
    void cleanUp() {
        cashTransactionRepository.deleteAllInBatch();
        movementRepository.deleteAllInBatch();
        holdingRepository.deleteAllInBatch();
        accountRepository.deleteAllInBatch();
        userRepository.deleteAllInBatch();
        priceRepository.deleteAllInBatch();
        rateRepository.deleteAllInBatch();
        investmentRepository.deleteAllInBatch();
        currencyRepository.findAll().stream()
                .filter(c -> !c.isBase())
                .forEach(currencyRepository::delete);
    }

    protected UserDto user(String initials) {
        return userService.create(new UserRequest(initials, "Test", "User " + initials, "HL"));
    }

    protected AccountDto account(Long userId, String type) {
        return accountService.create(userId, new CreateAccountRequest(type, "REF-" + type, null));
    }

    protected AccountDto account(Long userId, String type, String warnCash) {
        return accountService.create(userId, new CreateAccountRequest(type, "REF-" + type, new BigDecimal(warnCash)));
    }

    protected Long baseCurrencyId() {
        return currencyRepository.findByCode(Currency.BASE_CODE).orElseThrow().getId();
    }

    protected CurrencyDto currency(String code) {
        return currencyService.create(new CurrencyRequest(code, code + " currency"));
    }

    protected Long typeId(String shortDescription) {
        return investmentTypeRepository.findByShortDescription(shortDescription).orElseThrow().getId();
    }

    protected InvestmentDto investment(Long currencyId, String description) {
        return investmentService.create(new InvestmentRequest(currencyId, typeId("SHARE"), description,
                "LSE:" + description.substring(0, Math.min(4, description.length())).toUpperCase(), null, null));
    }

    protected HoldingDto holding(Long accountId, Long investmentId, String quantity, String averageCost) {
        return holdingService.create(accountId, new CreateHoldingRequest(investmentId,
                new BigDecimal(quantity), new BigDecimal(averageCost)));
    }

    protected void deposit(Long accountId, String amount) {
        cashLedgerService.record(accountId, new CashTransactionRequest("deposit", "2024-01-01", new BigDecimal(amount), null));
    }

    protected long cashScaled(Long accountId) {
        return accountRepository.findById(accountId).orElseThrow().getCashBalance();
    }

    protected static void assertAmount(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual), "expected " + expected + " but was " + actual);
    }
}
