package ru.perminov.ledger.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import ru.perminov.ledger.model.HoldingMovement;

import java.util.List;

@Repository
public interface HoldingMovementRepository extends JpaRepository<HoldingMovement, Long> {

    @Query("SELECT m FROM HoldingMovement m WHERE m.holding.id = :holdingId ORDER BY m.movementDate DESC, m.id DESC")
    List<HoldingMovement> findHistory(@Param("holdingId") Long holdingId, Pageable pageable);

    long countByHoldingId(Long holdingId);

    @Modifying
    @Query("DELETE FROM HoldingMovement m WHERE m.holding.id = :holdingId")
    int deleteByHoldingId(@Param("holdingId") Long holdingId);

    @Modifying
    @Query("DELETE FROM HoldingMovement m WHERE m.holding.id IN (SELECT h.id FROM Holding h WHERE h.account.id = :accountId)")
    int deleteByAccountId(@Param("accountId") Long accountId);
}
