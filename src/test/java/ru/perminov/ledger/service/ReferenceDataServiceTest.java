package ru.perminov.ledger.service;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import ru.perminov.ledger.LedgerTestSupport;
import ru.perminov.ledger.exception.NotFoundException;
import ru.perminov.ledger.exception.ValidationException;
import ru.perminov.ledger.service.ReferenceDataService.DatedValue;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ReferenceDataServiceTest extends LedgerTestSupport {

    private static final LocalDate JAN = LocalDate.of(2024, 1, 31);
    private static final LocalDate FEB = LocalDate.of(2024, 2, 29);

    @Autowired
    private ReferenceDataService referenceDataService;

    @Test
    void testLatestPriceIsNewestDateAndSameDateOverwrites() {
        Long investmentId = investment(baseCurrencyId(), "Golf Leisure").getId();
        assertTrue(referenceDataService.latestPrice(investmentId).isEmpty());

        referenceDataService.upsertPrice(investmentId, FEB, new BigDecimal("2.5"));
        referenceDataService.upsertPrice(investmentId, JAN, new BigDecimal("2.1"));
        referenceDataService.upsertPrice(investmentId, FEB, new BigDecimal("2.75"));

        DatedValue latest = referenceDataService.latestPrice(investmentId).orElseThrow();
        assertEquals(FEB, latest.date());
        assertEquals(27_500L, latest.scaled());
        assertEquals(2, priceRepository.count());

        assertEquals(21_000L, referenceDataService.priceOnDate(investmentId, JAN).orElseThrow().scaled());
        assertTrue(referenceDataService.priceOnDate(investmentId, LocalDate.of(2024, 1, 1)).isEmpty());
        assertEquals(List.of(FEB, JAN), referenceDataService.priceHistory(investmentId, 10).stream()
                .map(DatedValue::date).collect(Collectors.toList()));
    }

    @Test
    void testPriceLookupsRejectUnknownInvestment() {
        Long missing = investment(baseCurrencyId(), "India Foods").getId() + 1000;

        assertThrows(NotFoundException.class, () -> referenceDataService.latestPrice(missing));
        assertThrows(NotFoundException.class, () -> referenceDataService.priceOnDate(missing, JAN));
    }

    @Test
    void testBaseCurrencyRateIsImplicit() {
        Optional<DatedValue> rate = referenceDataService.latestRate(baseCurrencyId());

        assertTrue(rate.isPresent());
        assertEquals(10_000L, rate.get().scaled());
        assertNull(rate.get().date());
        ValidationException ex = assertThrows(ValidationException.class,
                () -> referenceDataService.upsertRate(baseCurrencyId(), JAN, BigDecimal.ONE));
        assertEquals("The base currency GBP has no exchange rate", ex.getMessage());
    }

    @Test
    void testLatestRatesHoldsNewestPerCurrency() {
        Long usd = currency("USD").getId();
        Long eur = currency("EUR").getId();
        currency("JPY");
        referenceDataService.upsertRate(usd, JAN, new BigDecimal("1.27"));
        referenceDataService.upsertRate(usd, FEB, new BigDecimal("1.26"));
        referenceDataService.upsertRate(eur, JAN, new BigDecimal("1.17"));

        Map<Long, DatedValue> rates = referenceDataService.latestRates();

        assertEquals(2, rates.size());
        assertEquals(new DatedValue(FEB, 12_600L), rates.get(usd));
        assertEquals(new DatedValue(JAN, 11_700L), rates.get(eur));
        assertEquals(12_600L, referenceDataService.latestRate(usd).orElseThrow().scaled());
    }

    @Test
    void testUpsertRejectsBadValues() {
        Long investmentId = investment(baseCurrencyId(), "Hotel Group").getId();

        assertThrows(ValidationException.class, () -> referenceDataService.upsertPrice(investmentId, JAN, BigDecimal.ZERO));
        assertThrows(ValidationException.class, () -> referenceDataService.upsertPrice(investmentId, JAN, new BigDecimal("-1")));
        assertThrows(ValidationException.class, () -> referenceDataService.upsertPrice(investmentId, JAN, null));
        assertThrows(ValidationException.class, () -> referenceDataService.upsertPrice(investmentId, null, BigDecimal.ONE));
        assertThrows(NotFoundException.class, () -> referenceDataService.upsertPrice(investmentId + 1000, JAN, BigDecimal.ONE));
        assertThrows(NotFoundException.class, () -> referenceDataService.latestRate(-1L));
    }
}
