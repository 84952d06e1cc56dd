package ru.perminov.ledger.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import ru.perminov.ledger.dto.CurrencyDto;
import ru.perminov.ledger.dto.CurrencyRequest;
import ru.perminov.ledger.dto.DatedValueDto;
import ru.perminov.ledger.dto.RateRequest;
import ru.perminov.ledger.service.CurrencyService;
import ru.perminov.ledger.service.ReferenceDataService;
import ru.perminov.ledger.util.RequestChecks;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/currencies")
@RequiredArgsConstructor
public class CurrencyController {

    private final CurrencyService currencyService;
    private final ReferenceDataService referenceDataService;

    @GetMapping
    public List<CurrencyDto> list() {
        return currencyService.list();
    }

    @GetMapping("/{id}")
    public CurrencyDto get(@PathVariable Long id) {
        return currencyService.get(id);
    }

    @PostMapping
    public ResponseEntity<CurrencyDto> create(@RequestBody CurrencyRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(currencyService.create(request));
    }

    @PutMapping("/{id}")
    public CurrencyDto update(@PathVariable Long id, @RequestBody CurrencyRequest request) {
        return currencyService.update(id, request);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        currencyService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/{id}/rates")
    public DatedValueDto upsertRate(@PathVariable Long id, @RequestBody RateRequest request) {
        ReferenceDataService.DatedValue stored = referenceDataService.upsertRate(id,
                RequestChecks.isoDate(request.rateDate(), "Rate date"), request.rate());
        return dto(id, stored);
    }

    @GetMapping("/{id}/rates/latest")
    public ResponseEntity<DatedValueDto> latestRate(@PathVariable Long id) {
        return referenceDataService.latestRate(id)
                .map(v -> ResponseEntity.ok(dto(id, v)))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/{id}/rates/{date}")
    public ResponseEntity<DatedValueDto> rateOnDate(@PathVariable Long id, @PathVariable String date) {
        return referenceDataService.rateOnDate(id, RequestChecks.isoDate(date, "Rate date"))
                .map(v -> ResponseEntity.ok(dto(id, v)))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/{id}/rates")
    public List<DatedValueDto> rateHistory(@PathVariable Long id,
                                           @RequestParam(defaultValue = "${ledger.history.default-limit:50}") int limit) {
        return referenceDataService.rateHistory(id, limit).stream()
                .map(v -> dto(id, v))
                .collect(Collectors.toList());
    }

    private static DatedValueDto dto(Long currencyId, ReferenceDataService.DatedValue value) {
        return new DatedValueDto(currencyId, value.date(), value.value(), value.scaled());
    }
}
