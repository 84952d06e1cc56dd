package ru.perminov.ledger.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import ru.perminov.ledger.dto.DatedValueDto;
import ru.perminov.ledger.dto.InvestmentDto;
import ru.perminov.ledger.dto.InvestmentRequest;
import ru.perminov.ledger.dto.InvestmentTypeDto;
import ru.perminov.ledger.dto.PriceRequest;
import ru.perminov.ledger.service.InvestmentService;
import ru.perminov.ledger.service.ReferenceDataService;
import ru.perminov.ledger.util.RequestChecks;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class InvestmentController {

    private final InvestmentService investmentService;
    private final ReferenceDataService referenceDataService;

    @GetMapping("/investment-types")
    public List<InvestmentTypeDto> types() {
        return investmentService.types();
    }

    @GetMapping("/investments")
    public List<InvestmentDto> list() {
        return investmentService.list();
    }

    @GetMapping("/investments/{id}")
    public InvestmentDto get(@PathVariable Long id) {
        return investmentService.get(id);
    }

    @PostMapping("/investments")
    public ResponseEntity<InvestmentDto> create(@RequestBody InvestmentRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(investmentService.create(request));
    }

    @PutMapping("/investments/{id}")
    public InvestmentDto update(@PathVariable Long id, @RequestBody InvestmentRequest request) {
        return investmentService.update(id, request);
    }

    @DeleteMapping("/investments/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        investmentService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/investments/{id}/prices")
    public DatedValueDto upsertPrice(@PathVariable Long id, @RequestBody PriceRequest request) {
        ReferenceDataService.DatedValue stored = referenceDataService.upsertPrice(id,
                RequestChecks.isoDate(request.priceDate(), "Price date"), request.price());
        return dto(id, stored);
    }

    @GetMapping("/investments/{id}/prices/latest")
    public ResponseEntity<DatedValueDto> latestPrice(@PathVariable Long id) {
        return referenceDataService.latestPrice(id)
                .map(v -> ResponseEntity.ok(dto(id, v)))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/investments/{id}/prices/{date}")
    public ResponseEntity<DatedValueDto> priceOnDate(@PathVariable Long id, @PathVariable String date) {
        return referenceDataService.priceOnDate(id, RequestChecks.isoDate(date, "Price date"))
                .map(v -> ResponseEntity.ok(dto(id, v)))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/investments/{id}/prices")
    public List<DatedValueDto> priceHistory(@PathVariable Long id,
                                            @RequestParam(defaultValue = "${ledger.history.default-limit:50}") int limit) {
        return referenceDataService.priceHistory(id, limit).stream()
                .map(v -> dto(id, v))
                .collect(Collectors.toList());
    }

    private static DatedValueDto dto(Long investmentId, ReferenceDataService.DatedValue value) {
        return new DatedValueDto(investmentId, value.date(), value.value(), value.scaled());
    }
}
