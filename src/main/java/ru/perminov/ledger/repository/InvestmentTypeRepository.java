package ru.perminov.ledger.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import ru.perminov.ledger.model.InvestmentType;

import java.util.List;
import java.util.Optional;

@Repository
public interface InvestmentTypeRepository extends JpaRepository<InvestmentType, Long> {

    Optional<InvestmentType> findByShortDescription(String shortDescription);

    List<InvestmentType> findAllByOrderByIdAsc();
}
