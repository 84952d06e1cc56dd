package ru.perminov.ledger.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import ru.perminov.ledger.model.ExchangeRate;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface ExchangeRateRepository extends JpaRepository<ExchangeRate, Long> {

    Optional<ExchangeRate> findFirstByCurrencyIdOrderByRateDateDesc(Long currencyId);

    Optional<ExchangeRate> findByCurrencyIdAndRateDate(Long currencyId, LocalDate rateDate);

    @Query("SELECT r FROM ExchangeRate r WHERE r.currency.id = :currencyId ORDER BY r.rateDate DESC")
    List<ExchangeRate> findHistory(@Param("currencyId") Long currencyId, Pageable pageable);

    /**
     * Newest rate of every currency that has at least one.
     */
    @Query("SELECT r FROM ExchangeRate r JOIN FETCH r.currency c " +
           "WHERE r.rateDate = (SELECT MAX(r2.rateDate) FROM ExchangeRate r2 WHERE r2.currency = r.currency)")
    List<ExchangeRate> findLatestPerCurrency();

    @Modifying
    @Query("DELETE FROM ExchangeRate r WHERE r.currency.id = :currencyId")
    int deleteByCurrencyId(@Param("currencyId") Long currencyId);
}
