package ru.perminov.ledger.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import ru.perminov.ledger.dto.InvestmentDto;
import ru.perminov.ledger.dto.InvestmentRequest;
import ru.perminov.ledger.dto.InvestmentTypeDto;
import ru.perminov.ledger.exception.ConflictException;
import ru.perminov.ledger.exception.IntegrityException;
import ru.perminov.ledger.exception.NotFoundException;
import ru.perminov.ledger.exception.ValidationException;
import ru.perminov.ledger.model.Currency;
import ru.perminov.ledger.model.Investment;
import ru.perminov.ledger.model.InvestmentType;
import ru.perminov.ledger.repository.CurrencyRepository;
import ru.perminov.ledger.repository.HoldingRepository;
import ru.perminov.ledger.repository.InvestmentRepository;
import ru.perminov.ledger.repository.InvestmentTypeRepository;
import ru.perminov.ledger.repository.PriceRepository;
import ru.perminov.ledger.util.RequestChecks;

import java.util.List;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class InvestmentService {

    private final InvestmentRepository investmentRepository;
    private final InvestmentTypeRepository typeRepository;
    private final CurrencyRepository currencyRepository;
    private final HoldingRepository holdingRepository;
    private final PriceRepository priceRepository;

    @Transactional(readOnly = true)
    public List<InvestmentDto> list() {
        return investmentRepository.findAllWithDetails().stream()
                .map(InvestmentDto::from)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public InvestmentDto get(Long id) {
        return InvestmentDto.from(investmentRepository.findWithDetailsById(id)
                .orElseThrow(() -> NotFoundException.of("Investment", id)));
    }

    @Transactional(readOnly = true)
    public List<InvestmentTypeDto> types() {
        return typeRepository.findAllByOrderByIdAsc().stream()
                .map(InvestmentTypeDto::from)
                .collect(Collectors.toList());
    }

    @Transactional
    public InvestmentDto create(InvestmentRequest request) {
        Investment investment = new Investment();
        apply(investment, request);
        Investment saved = save(investment);
        log.info("Investment created: id={}, description={}, currency={}",
                saved.getId(), saved.getDescription(), saved.getCurrency().getCode());
        return InvestmentDto.from(saved);
    }

    @Transactional
    public InvestmentDto update(Long id, InvestmentRequest request) {
        Investment investment = investmentRepository.findById(id)
                .orElseThrow(() -> NotFoundException.of("Investment", id));
        apply(investment, request);
        Investment saved = save(investment);
        log.info("Investment updated: id={}", id);
        return InvestmentDto.from(saved);
    }

    /**
     * Removes an investment with its price history. Refused while any account holds it.
     */
    @Transactional
    public void delete(Long id) {
        Investment investment = investmentRepository.findById(id)
                .orElseThrow(() -> NotFoundException.of("Investment", id));
        if (holdingRepository.existsByInvestmentId(id)) {
            throw new ConflictException("Investment '" + investment.getDescription() + "' is held in one or more accounts");
        }
        int prices = priceRepository.deleteByInvestmentId(id);
        investmentRepository.delete(investment);
        log.info("Investment deleted: id={}, pricesRemoved={}", id, prices);
    }

    private void apply(Investment investment, InvestmentRequest request) {
        if (request.currencyId() == null) {
            throw new ValidationException("Currency is required");
        }
        if (request.investmentTypeId() == null) {
            throw new ValidationException("Investment type is required");
        }
        String description = RequestChecks.text(request.description(), "Description", 60);
        String publicId = RequestChecks.optionalText(request.publicId(), "Public ID", 20);
        String url = RequestChecks.optionalText(request.investmentUrl(), "Investment URL", 255);
        String selector = RequestChecks.optionalText(request.selector(), "Selector", 255);

        Currency currency = currencyRepository.findById(request.currencyId())
                .orElseThrow(() -> NotFoundException.of("Currency", request.currencyId()));
        InvestmentType type = typeRepository.findById(request.investmentTypeId())
                .orElseThrow(() -> NotFoundException.of("Investment type", request.investmentTypeId()));

        investment.setCurrency(currency);
        investment.setInvestmentType(type);
        investment.setDescription(description);
        investment.setPublicId(publicId);
        investment.setInvestmentUrl(url);
        investment.setSelector(selector);
    }

    private Investment save(Investment investment) {
        try {
            return investmentRepository.saveAndFlush(investment);
        } catch (DataIntegrityViolationException e) {
            throw new IntegrityException("Investment rejected by the store: " + e.getMostSpecificCause().getMessage(), e);
        }
    }
}
