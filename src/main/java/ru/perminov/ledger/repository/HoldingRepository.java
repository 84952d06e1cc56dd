package ru.perminov.ledger.repository;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import ru.perminov.ledger.model.Holding;

import java.util.List;
import java.util.Optional;

@Repository
public interface HoldingRepository extends JpaRepository<Holding, Long> {

    boolean existsByAccountIdAndInvestmentId(Long accountId, Long investmentId);

    boolean existsByInvestmentId(Long investmentId);

    @Query("SELECT h FROM Holding h JOIN FETCH h.investment i JOIN FETCH i.currency " +
           "WHERE h.account.id = :accountId ORDER BY i.description, h.id")
    List<Holding> findByAccountIdWithInvestment(@Param("accountId") Long accountId);

    @Query("SELECT h FROM Holding h JOIN FETCH h.investment i JOIN FETCH i.currency WHERE h.id = :id")
    Optional<Holding> findWithInvestmentById(@Param("id") Long id);

    /**
     * Owning account id without loading the holding into the persistence context,
     * so the locked read that follows sees the committed row.
     */
    @Query("SELECT h.account.id FROM Holding h WHERE h.id = :id")
    Optional<Long> findAccountIdById(@Param("id") Long id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT h FROM Holding h WHERE h.id = :id")
    Optional<Holding> findByIdForUpdate(@Param("id") Long id);

    @Modifying
    @Query("DELETE FROM Holding h WHERE h.account.id = :accountId")
    int deleteByAccountId(@Param("accountId") Long accountId);
}
