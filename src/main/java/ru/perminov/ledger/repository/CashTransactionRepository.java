package ru.perminov.ledger.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import ru.perminov.ledger.model.CashTransaction;

import java.util.List;

@Repository
public interface CashTransactionRepository extends JpaRepository<CashTransaction, Long> {

    @Query("SELECT t FROM CashTransaction t LEFT JOIN FETCH t.holdingMovement " +
           "WHERE t.account.id = :accountId ORDER BY t.transactionDate DESC, t.id DESC")
    List<CashTransaction> findHistory(@Param("accountId") Long accountId, Pageable pageable);

    boolean existsByReversesTransactionId(Long reversesTransactionId);

    long countByAccountId(Long accountId);

    @Modifying
    @Query("DELETE FROM CashTransaction t WHERE t.holdingMovement.id IN " +
           "(SELECT m.id FROM HoldingMovement m WHERE m.holding.id = :holdingId)")
    int deleteByHoldingId(@Param("holdingId") Long holdingId);

    @Modifying
    @Query("DELETE FROM CashTransaction t WHERE t.account.id = :accountId")
    int deleteByAccountId(@Param("accountId") Long accountId);
}
