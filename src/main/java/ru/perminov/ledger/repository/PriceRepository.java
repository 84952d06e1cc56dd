package ru.perminov.ledger.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import ru.perminov.ledger.model.Price;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface PriceRepository extends JpaRepository<Price, Long> {

    Optional<Price> findFirstByInvestmentIdOrderByPriceDateDesc(Long investmentId);

    Optional<Price> findByInvestmentIdAndPriceDate(Long investmentId, LocalDate priceDate);

    @Query("SELECT p FROM Price p WHERE p.investment.id = :investmentId ORDER BY p.priceDate DESC")
    List<Price> findHistory(@Param("investmentId") Long investmentId, Pageable pageable);

    @Modifying
    @Query("DELETE FROM Price p WHERE p.investment.id = :investmentId")
    int deleteByInvestmentId(@Param("investmentId") Long investmentId);
}
