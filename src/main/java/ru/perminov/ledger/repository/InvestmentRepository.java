package ru.perminov.ledger.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import ru.perminov.ledger.model.Investment;

import java.util.List;
import java.util.Optional;

@Repository
public interface InvestmentRepository extends JpaRepository<Investment, Long> {

    boolean existsByCurrencyId(Long currencyId);

    @Query("SELECT i FROM Investment i JOIN FETCH i.currency JOIN FETCH i.investmentType ORDER BY i.description, i.id")
    List<Investment> findAllWithDetails();

    @Query("SELECT i FROM Investment i JOIN FETCH i.currency JOIN FETCH i.investmentType WHERE i.id = :id")
    Optional<Investment> findWithDetailsById(@Param("id") Long id);
}
